package io.muse.persistence.jdbc.bind;

import io.muse.persistence.jdbc.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Binds one value into a prepared statement. The first binder that supports a bind wins. */
public interface JdbcBinder {
  boolean supports(Bind bind);

  void bind(PreparedStatement ps, int position1Based, Bind bind) throws SQLException;
}
