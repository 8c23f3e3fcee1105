package org.h2ox.api.warehouse;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One result row as an ordered tuple of scalars, in the order of the query's projection.
 * Typed accessors throw {@link IllegalStateException} when a column has an unexpected type.
 */
public record WarehouseRow(List<Object> values) {

  public WarehouseRow {
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static WarehouseRow of(Object... values) {
    List<Object> list = new ArrayList<>(values.length);
    Collections.addAll(list, values);
    return new WarehouseRow(list);
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    if (index < 0 || index >= values.size()) {
      throw new IllegalStateException("Row has " + values.size() + " columns, no column " + index);
    }
    return values.get(index);
  }

  public String getString(int index) {
    Object value = get(index);
    if (value == null) {
      return null;
    }
    if (value instanceof String text) {
      return text;
    }
    throw typeMismatch(index, "text", value);
  }

  public LocalDate getDate(int index) {
    Object value = get(index);
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDate date) {
      return date;
    }
    throw typeMismatch(index, "date", value);
  }

  public Double getDouble(int index) {
    Object value = get(index);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw typeMismatch(index, "number", value);
  }

  public Integer getInteger(int index) {
    Object value = get(index);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    throw typeMismatch(index, "integer", value);
  }

  /** Array column as doubles; elements may be {@code null}. */
  public List<Double> getDoubleList(int index) {
    Object value = get(index);
    if (value == null) {
      return null;
    }
    if (!(value instanceof List<?> list)) {
      throw typeMismatch(index, "array", value);
    }
    List<Double> out = new ArrayList<>(list.size());
    for (Object element : list) {
      if (element == null) {
        out.add(null);
      } else if (element instanceof Number number) {
        out.add(number.doubleValue());
      } else {
        throw typeMismatch(index, "numeric array", element);
      }
    }
    return out;
  }

  private static IllegalStateException typeMismatch(int index, String expected, Object actual) {
    return new IllegalStateException("Column " + index + " expected " + expected + " but was "
        + actual.getClass().getSimpleName());
  }
}
