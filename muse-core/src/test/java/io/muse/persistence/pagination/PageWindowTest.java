package io.muse.persistence.pagination;

import io.muse.persistence.query.OffsetPage;
import io.muse.persistence.query.Query;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PageWindowTest {
  /** Keys equal row numbers, so a page's cursor is also the row number before it. */
  private static List<BoundaryRow> rows(long n) {
    List<BoundaryRow> out = new ArrayList<>();
    for (long i = 1; i <= n; i++) out.add(new BoundaryRow(i, i));
    return out;
  }

  private static PaginationInfo info(long n, int pageSize, int surrounding, long requestedRow) {
    PageWindow w = PageWindow.of(n, pageSize, surrounding, requestedRow);
    Query q = new Query().withPage(new OffsetPage(w.cursorRow(), pageSize));
    return w.toInfo(rows(n), q);
  }

  @Test
  void firstPageOf101RowsReportsFiveShortLastPage() {
    PaginationInfo info = info(101, 25, 5, 0);
    assertEquals(101, info.collectionSize());
    assertEquals(0, info.cursorRow());
    assertEquals(1, info.cursorPage());
    assertEquals(new PageInfo(100L, 5, 101), info.lastPage());
    assertEquals(List.of(new PageInfo(25L, 2, 26), new PageInfo(50L, 3, 51), new PageInfo(75L, 4, 76)),
        info.surroundingPages());
  }

  @Test
  void cursorAtRow25IsPageTwo() {
    PaginationInfo info = info(101, 25, 5, 25);
    assertEquals(25, info.cursorRow());
    assertEquals(2, info.cursorPage());
    assertEquals(List.of(new PageInfo(50L, 3, 51), new PageInfo(75L, 4, 76)), info.surroundingPages());
    assertEquals(5, info.lastPage().page());
  }

  @Test
  void unalignedCursorShiftsPageNumbersByTwo() {
    PaginationInfo info = info(101, 25, 5, 30);
    assertEquals(3, info.cursorPage());
    assertEquals(List.of(new PageInfo(5L, 2, 6), new PageInfo(55L, 4, 56)), info.surroundingPages());
    assertEquals(new PageInfo(80L, 5, 81), info.lastPage());
  }

  @Test
  void phantomTrailingPageIsDropped() {
    PaginationInfo info = info(100, 25, 5, 0);
    assertEquals(new PageInfo(75L, 4, 76), info.lastPage());
    assertFalse(info.surroundingPages().stream().anyMatch(p -> p.row() > 100));
  }

  @Test
  void cursorPastTheEndSnapsToLastAlignedPage() {
    PageWindow w = PageWindow.of(101, 25, 5, 101);
    assertEquals(100, w.cursorRow());
    PaginationInfo info = w.toInfo(rows(101), new Query());
    assertEquals(5, info.cursorPage());
    assertTrue(info.isLastPage());
    assertTrue(info.cursorRow() < info.collectionSize());
  }

  @Test
  void lastPageIsIncludedEvenFarOutsideTheWindow() {
    PaginationInfo info = info(1000, 10, 2, 500);
    assertEquals(new PageInfo(990L, 100, 991), info.lastPage());
    assertEquals(List.of(480L, 490L, 510L, 520L),
        info.surroundingPages().stream().map(PageInfo::cursor).toList());
  }

  @Test
  void surroundingPagesStayWithinBound() {
    for (int s = 0; s <= 4; s++) {
      for (long r = 0; r < 300; r += 7) {
        PaginationInfo info = info(300, 10, s, r);
        assertTrue(info.surroundingPages().size() <= 2 * s + 2, "s=" + s + " r=" + r);
        assertFalse(info.surroundingPages().stream().anyMatch(p -> p.page() == info.cursorPage()));
      }
    }
  }

  @Test
  void lastPageNeverStartsPastTheFinalRow() {
    for (int p = 1; p <= 12; p++) {
      for (long n = p + 1; n <= 5L * p + 3; n++) {
        PaginationInfo info = info(n, p, 1, 0);
        assertNotNull(info.lastPage(), "n=" + n + " p=" + p);
        assertTrue(info.lastPage().row() + p > n, "n=" + n + " p=" + p);
        assertEquals((n + p - 1) / p, info.lastPage().page(), "n=" + n + " p=" + p);
      }
    }
  }

  @Test
  void surroundingPageCursorsRoundTrip() {
    for (long r : new long[] {0, 25, 30, 49, 75}) {
      PaginationInfo info = info(101, 25, 2, r);
      for (PageInfo page : info.surroundingPages()) {
        PaginationInfo next = info(101, 25, 2, (Long) page.cursor());
        assertEquals(page.page(), next.cursorPage(), "from row " + r + " via " + page);
        assertEquals(page.row() - 1, next.cursorRow());
      }
    }
  }

  @Test
  void singlePageUsesPageOneAsLastPage() {
    PaginationInfo info = PageWindow.singlePage(7, new Query().withPage(new OffsetPage(0, 25)));
    assertEquals(1, info.cursorPage());
    assertTrue(info.surroundingPages().isEmpty());
    assertEquals(new PageInfo(null, 1, 0), info.lastPage());
    assertTrue(info.isLastPage());
  }

  @Test
  void changingPageSizeKeepsOldAlignment() {
    // Offset 25 was a page boundary at 25 rows per page; at 50 rows per page it is not, so the
    // cursor page is numbered as if a short leading page existed.
    PaginationInfo info = info(101, 50, 5, 25);
    assertEquals(25, info.cursorRow());
    assertEquals(2, info.cursorPage());
    assertTrue(info.surroundingPages().isEmpty());
    assertEquals(new PageInfo(75L, 3, 76), info.lastPage());
  }

  @Test
  void rejectsNonPositivePageSize() {
    assertThrows(IllegalArgumentException.class, () -> PageWindow.of(10, 0, 5, 0));
  }
}
