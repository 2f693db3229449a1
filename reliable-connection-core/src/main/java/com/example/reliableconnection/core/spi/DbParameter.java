package com.example.reliableconnection.core.spi;

import java.util.Objects;

/**
 * A named, ordered command parameter.
 *
 * <p>{@code sqlType} holds a {@link java.sql.Types} constant, or {@code null} to let the driver
 * infer the type from the value.
 */
public final class DbParameter {

  private final String name;
  private Object value;
  private Integer sqlType;
  private ParameterDirection direction;

  public DbParameter(final String name, final Object value) {
    this(name, value, null, ParameterDirection.INPUT);
  }

  public DbParameter(
      final String name,
      final Object value,
      final Integer sqlType,
      final ParameterDirection direction) {
    this.name = name;
    this.value = value;
    this.sqlType = sqlType;
    this.direction = Objects.requireNonNull(direction, "direction");
  }

  public String getName() {
    return name;
  }

  public Object getValue() {
    return value;
  }

  public void setValue(final Object value) {
    this.value = value;
  }

  public Integer getSqlType() {
    return sqlType;
  }

  public void setSqlType(final Integer sqlType) {
    this.sqlType = sqlType;
  }

  public ParameterDirection getDirection() {
    return direction;
  }

  public void setDirection(final ParameterDirection direction) {
    this.direction = Objects.requireNonNull(direction, "direction");
  }

  @Override
  public String toString() {
    return "DbParameter[" + name + ", " + direction + "]";
  }
}
