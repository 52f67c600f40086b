package com.example.devicestore.core.config;

import static org.junit.jupiter.api.Assertions.*;

import com.example.devicestore.core.Retry;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class StoreConfigTest {

  @Test
  @DisplayName("Should read JSON and apply credential overrides")
  void readsJson() throws Exception {
    try (final var in = getClass().getClassLoader().getResourceAsStream("store-config.json")) {
      final var config = StoreConfig.fromJson(in);

      assertEquals("postgres", config.driver());
      assertEquals(4, config.maximumPoolSize());
      assertEquals(12, config.queryTimeoutSeconds());
      assertEquals(StoreConfig.DEFAULT_CONNECTION_TIMEOUT_MILLIS, config.connectionTimeoutMillis());

      final var connection = config.connection();
      assertEquals(
          "jdbc:postgresql://db.internal:6543/devices?sslmode=disable", connection.jdbcUrl());
      assertEquals("mdm", connection.username());
      assertEquals("from-config", connection.password());

      assertEquals(
          new Retry.Policy(5, 250L, Long.MAX_VALUE, Retry.Backoff.LINEAR), config.connectPolicy());
    }
  }

  @Test
  @DisplayName("Should apply defaults for a bare connection string")
  void appliesDefaults() {
    final var config = StoreConfig.of("postgres", "dbname=devices");

    assertEquals(StoreConfig.DEFAULT_MAXIMUM_POOL_SIZE, config.maximumPoolSize());
    assertEquals(StoreConfig.DEFAULT_QUERY_TIMEOUT_SECONDS, config.queryTimeoutSeconds());
    assertEquals(20, config.connectPolicy().maxAttempts());
    assertEquals(1_000L, config.connectPolicy().calculateDelay(2));
    assertEquals(2_000L, config.connectPolicy().calculateDelay(3));
  }

  @Test
  @DisplayName("Should reject negative settings")
  void rejectsNegativeSettings() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StoreConfig("postgres", "dbname=d", null, null, -1, 0L, 0, 0, 0L));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StoreConfig("postgres", "dbname=d", null, null, 0, 0L, -5, 0, 0L));
  }

  @Test
  @DisplayName("Should fail to parse invalid JSON")
  void rejectsInvalidJson() {
    final var in = new ByteArrayInputStream("{\"driver\":".getBytes(StandardCharsets.UTF_8));

    assertThrows(IOException.class, () -> StoreConfig.fromJson(in));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "postgres://mdm:hunter2@db/devices",
        "host=db dbname=devices user=mdm password=hunter2 sslmode=disable",
        "host=db dbname=devices user=mdm password='hunter2 and more' sslmode=disable",
        "jdbc:postgresql://db:5432/devices?user=mdm&password=hunter2&sslmode=disable",
        "jdbc:postgresql://db:5432/devices?PASSWORD=hunter2"
      })
  @DisplayName("toString should not leak the password in any connection string form")
  void toStringRedacts(final String url) {
    final var text = StoreConfig.of("postgres", url).toString();

    assertFalse(text.contains("hunter2"), text);
    assertFalse(text.contains("and more"), text);
    assertTrue(text.contains("db"), text);
  }

  @Nested
  @DisplayName("Custom ObjectMapper")
  class CustomMapper {

    private static final String JSON_WITH_COMMENTS =
        "{ // primary store\n \"driver\": \"postgres\", \"url\": \"dbname=devices\" }";

    @AfterEach
    void restoreDefaultMapper() {
      StoreConfig.setMapperSupplier(ObjectMapper::new);
    }

    @Test
    @DisplayName("Should read with the mapper installed through setMapperSupplier")
    void usesSuppliedMapper() throws Exception {
      final var mapper = new ObjectMapper().configure(JsonParser.Feature.ALLOW_COMMENTS, true);
      StoreConfig.setMapperSupplier(() -> mapper);

      final var config = StoreConfig.fromJson(stream(JSON_WITH_COMMENTS));

      assertEquals("postgres", config.driver());
      assertEquals("jdbc:postgresql://localhost:5432/devices", config.connection().jdbcUrl());
    }

    @Test
    @DisplayName("Default mapper should reject comments")
    void defaultMapperIsStrict() {
      assertThrows(IOException.class, () -> StoreConfig.fromJson(stream(JSON_WITH_COMMENTS)));
    }

    private ByteArrayInputStream stream(final String json) {
      return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
  }
}
