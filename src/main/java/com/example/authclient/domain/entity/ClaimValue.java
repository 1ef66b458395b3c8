package com.example.authclient.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A JSON-like claim value: null, string, integer, boolean, double, array or map.
 * <p>
 * Every accessor is an explicit conversion returning empty when the variant does not match,
 * so callers never cast.
 */
@JsonDeserialize(using = ClaimValueDeserializer.class)
public sealed interface ClaimValue {

  default Optional<String> asString() {
    return Optional.empty();
  }

  default Optional<Long> asLong() {
    return Optional.empty();
  }

  default Optional<Integer> asInteger() {
    return asLong()
        .filter(v -> v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
        .map(Long::intValue);
  }

  default Optional<Boolean> asBoolean() {
    return Optional.empty();
  }

  default Optional<Double> asDouble() {
    return Optional.empty();
  }

  default Optional<List<ClaimValue>> asList() {
    return Optional.empty();
  }

  default Optional<Map<String, ClaimValue>> asMap() {
    return Optional.empty();
  }

  /**
   * A list whose elements are all strings; empty otherwise.
   */
  default Optional<List<String>> asStringList() {
    return asList().flatMap(items -> {
      List<String> strings = new ArrayList<>(items.size());
      for (ClaimValue item : items) {
        Optional<String> s = item.asString();
        if (s.isEmpty()) {
          return Optional.empty();
        }
        strings.add(s.get());
      }
      return Optional.of(List.copyOf(strings));
    });
  }

  /**
   * Boolean, or a string spelled exactly {@code "true"} / {@code "false"}.
   */
  default Optional<Boolean> coerceBoolean() {
    Optional<Boolean> direct = asBoolean();
    if (direct.isPresent()) {
      return direct;
    }
    return asString().flatMap(s -> switch (s) {
      case "true" -> Optional.of(Boolean.TRUE);
      case "false" -> Optional.of(Boolean.FALSE);
      default -> Optional.empty();
    });
  }

  /**
   * Integer, or a string holding a decimal integer.
   */
  default Optional<Integer> coerceInteger() {
    Optional<Integer> direct = asInteger();
    if (direct.isPresent()) {
      return direct;
    }
    return asString().flatMap(s -> {
      try {
        return Optional.of(Integer.parseInt(s));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    });
  }

  default boolean isNull() {
    return false;
  }

  /**
   * Plain Java representation (String, Long, Boolean, Double, List, Map or null).
   */
  Object unwrap();

  /**
   * Human readable rendering, used when a string is requested from a non-string value.
   */
  default String render() {
    return String.valueOf(unwrap());
  }

  static ClaimValue of(Object raw) {
    if (raw == null) {
      return NullValue.INSTANCE;
    }
    if (raw instanceof ClaimValue value) {
      return value;
    }
    if (raw instanceof String s) {
      return new StringValue(s);
    }
    if (raw instanceof Boolean b) {
      return new BoolValue(b);
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
      return new IntValue(((Number) raw).longValue());
    }
    if (raw instanceof BigInteger big) {
      return big.bitLength() < 64 ? new IntValue(big.longValue()) : new DoubleValue(big.doubleValue());
    }
    if (raw instanceof BigDecimal dec) {
      return new DoubleValue(dec.doubleValue());
    }
    if (raw instanceof Number n) {
      return new DoubleValue(n.doubleValue());
    }
    if (raw instanceof Date date) {
      return new IntValue(date.getTime() / 1000);
    }
    if (raw instanceof Instant instant) {
      return new IntValue(instant.getEpochSecond());
    }
    if (raw instanceof JsonNode node) {
      return fromJson(node);
    }
    if (raw instanceof Collection<?> items) {
      return new ArrayValue(items.stream().map(ClaimValue::of).collect(Collectors.toList()));
    }
    if (raw instanceof Object[] items) {
      List<ClaimValue> values = new ArrayList<>(items.length);
      for (Object item : items) {
        values.add(of(item));
      }
      return new ArrayValue(values);
    }
    if (raw instanceof Map<?, ?> map) {
      Map<String, ClaimValue> values = new LinkedHashMap<>();
      map.forEach((k, v) -> values.put(String.valueOf(k), of(v)));
      return new MapValue(values);
    }
    return new StringValue(raw.toString());
  }

  static ClaimValue fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NullValue.INSTANCE;
    }
    if (node.isTextual()) {
      return new StringValue(node.textValue());
    }
    if (node.isBoolean()) {
      return new BoolValue(node.booleanValue());
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return new IntValue(node.longValue());
    }
    if (node.isNumber()) {
      return new DoubleValue(node.doubleValue());
    }
    if (node.isArray()) {
      List<ClaimValue> values = new ArrayList<>(node.size());
      node.forEach(item -> values.add(fromJson(item)));
      return new ArrayValue(values);
    }
    if (node.isObject()) {
      Map<String, ClaimValue> values = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        values.put(field.getKey(), fromJson(field.getValue()));
      }
      return new MapValue(values);
    }
    return new StringValue(node.asText());
  }

  record NullValue() implements ClaimValue {
    public static final NullValue INSTANCE = new NullValue();

    @Override
    public boolean isNull() {
      return true;
    }

    @Override
    public Object unwrap() {
      return null;
    }
  }

  record StringValue(String value) implements ClaimValue {
    @Override
    public Optional<String> asString() {
      return Optional.of(value);
    }

    @Override
    public Object unwrap() {
      return value;
    }
  }

  record IntValue(long value) implements ClaimValue {
    @Override
    public Optional<Long> asLong() {
      return Optional.of(value);
    }

    @Override
    public Optional<Double> asDouble() {
      return Optional.of((double) value);
    }

    @Override
    public Object unwrap() {
      return value;
    }
  }

  record BoolValue(boolean value) implements ClaimValue {
    @Override
    public Optional<Boolean> asBoolean() {
      return Optional.of(value);
    }

    @Override
    public Object unwrap() {
      return value;
    }
  }

  record DoubleValue(double value) implements ClaimValue {
    @Override
    public Optional<Double> asDouble() {
      return Optional.of(value);
    }

    @Override
    public Object unwrap() {
      return value;
    }
  }

  record ArrayValue(List<ClaimValue> values) implements ClaimValue {
    public ArrayValue {
      values = List.copyOf(values);
    }

    @Override
    public Optional<List<ClaimValue>> asList() {
      return Optional.of(values);
    }

    @Override
    public Object unwrap() {
      List<Object> plain = new ArrayList<>(values.size());
      values.forEach(v -> plain.add(v.unwrap()));
      return Collections.unmodifiableList(plain);
    }
  }

  record MapValue(Map<String, ClaimValue> values) implements ClaimValue {
    public MapValue {
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public Optional<Map<String, ClaimValue>> asMap() {
      return Optional.of(values);
    }

    @Override
    public Object unwrap() {
      Map<String, Object> plain = new LinkedHashMap<>();
      values.forEach((k, v) -> plain.put(k, v.unwrap()));
      return Collections.unmodifiableMap(plain);
    }
  }
}
