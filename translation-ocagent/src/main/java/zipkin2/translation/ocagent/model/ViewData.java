/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** The rows of a {@link View} aggregated over the window from {@link #start()} to {@link #end()}. */
public final class ViewData {

  public static ViewData create(View view, Instant start, Instant end, List<Row> rows) {
    if (view == null) throw new NullPointerException("view == null");
    if (start == null) throw new NullPointerException("start == null");
    if (end == null) throw new NullPointerException("end == null");
    return new ViewData(view, start, end, ModelUtils.copyList("rows", rows));
  }

  private final View view;
  private final Instant start, end;
  private final List<Row> rows;

  private ViewData(View view, Instant start, Instant end, List<Row> rows) {
    this.view = view;
    this.start = start;
    this.end = end;
    this.rows = rows;
  }

  public View view() {
    return view;
  }

  public Instant start() {
    return start;
  }

  public Instant end() {
    return end;
  }

  public List<Row> rows() {
    return rows;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ViewData)) return false;
    ViewData that = (ViewData) o;
    return view.equals(that.view)
        && start.equals(that.start)
        && end.equals(that.end)
        && rows.equals(that.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(view, start, end, rows);
  }

  @Override
  public String toString() {
    return "ViewData{view=" + view.name() + ", start=" + start + ", end=" + end
        + ", rows=" + rows.size() + "}";
  }
}
