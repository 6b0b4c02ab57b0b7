package io.muse.persistence.jdbc.bind;

import io.muse.persistence.collection.FieldType;
import io.muse.persistence.jdbc.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered binder chain. Dialect binders are evaluated before the base JDBC binders.
 */
public final class JdbcBinders {
  private final List<JdbcBinder> binders;

  public JdbcBinders(Collection<? extends JdbcBinder> dialectBinders) {
    List<JdbcBinder> out = new ArrayList<>(dialectBinders);
    out.add(new InstantToTimestampBinder());
    out.add(new NullBinder());
    out.add(new SetObjectBinder());
    this.binders = List.copyOf(out);
  }

  public void bindAll(PreparedStatement ps, List<Bind> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) {
      Bind b = binds.get(i);
      binderFor(b).bind(ps, i + 1, b);
    }
  }

  private JdbcBinder binderFor(Bind b) {
    for (JdbcBinder binder : binders) {
      if (binder.supports(b)) return binder;
    }
    throw new IllegalStateException("No binder for " + b);
  }

  static int sqlType(FieldType type) {
    if (type == null) return Types.BIGINT;
    return switch (type) {
      case STRING -> Types.VARCHAR;
      case INT -> Types.INTEGER;
      case LONG -> Types.BIGINT;
      case BOOLEAN -> Types.BOOLEAN;
      case UUID -> Types.OTHER;
      case INSTANT -> Types.TIMESTAMP;
      case DECIMAL -> Types.NUMERIC;
    };
  }

  /** Instant as JDBC Timestamp. */
  static final class InstantToTimestampBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return bind.value() instanceof Instant;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setTimestamp(pos, Timestamp.from((Instant) bind.value()));
    }
  }

  static final class NullBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return bind.value() == null;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setNull(pos, sqlType(bind.type()));
    }
  }

  static final class SetObjectBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) {
      return true;
    }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setObject(pos, bind.value());
    }
  }
}
