package io.b2mash.payables.export;

/**
 * Column of an {@link ExportTable}.
 *
 * @param type one of {@code string}, {@code date}, {@code currency}, {@code integer}
 */
public record ExportColumn(String key, String label, String type) {

  public static ExportColumn text(String key, String label) {
    return new ExportColumn(key, label, "string");
  }

  public static ExportColumn date(String key, String label) {
    return new ExportColumn(key, label, "date");
  }

  public static ExportColumn currency(String key, String label) {
    return new ExportColumn(key, label, "currency");
  }

  public static ExportColumn integer(String key, String label) {
    return new ExportColumn(key, label, "integer");
  }
}
