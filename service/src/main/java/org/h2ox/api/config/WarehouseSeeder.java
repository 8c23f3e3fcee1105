package org.h2ox.api.config;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Loads a small deterministic reservoir dataset into an empty warehouse for local development
 * and integration tests. Volumes are in billion cubic meters, precipitation in millimeters.
 */
@Component
public class WarehouseSeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(WarehouseSeeder.class);
  static final LocalDate SEED_START = LocalDate.of(2018, 6, 1);
  static final LocalDate SEED_END = LocalDate.of(2022, 1, 10);
  static final int FORECAST_DAYS = 90;

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final Environment environment;
  private final boolean seedEnabled;
  private final Random random = new Random(8675309L);

  public WarehouseSeeder(JdbcTemplate jdbcTemplate,
      TransactionTemplate transactionTemplate,
      Environment environment,
      @Value("${warehouse.seed.enabled:true}") boolean seedEnabled) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
    this.environment = environment;
    this.seedEnabled = seedEnabled;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Warehouse seeding disabled via property warehouse.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping warehouse seeding because active profile includes prod");
      return;
    }
    Long existing = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM reservoir", Long.class);
    if (existing != null && existing > 0) {
      log.info("Warehouse already contains {} reservoirs; skipping seeding", existing);
      return;
    }
    transactionTemplate.executeWithoutResult(status -> seedWarehouse());
  }

  void seedWarehouse() {
    log.info("Seeding warehouse with sample reservoir dataset");
    List<SeedReservoir> seeds = List.of(
        new SeedReservoir("Harangi", 0.2305, 0.55, null),
        new SeedReservoir("Hemavathy", 1.0500, 0.50, square(76.0, 12.9)),
        new SeedReservoir("Kabini", 0.5530, 0.60, square(76.3, 11.9)),
        new SeedReservoir("KRS", 1.3700, 0.45, square(76.6, 12.4)));

    long levelRows = 0;
    long precipRows = 0;
    for (SeedReservoir seed : seeds) {
      jdbcTemplate.update(
          "INSERT INTO reservoir(name, full_volume_bcm, geom_geojson) VALUES (?, ?, ?)",
          seed.name(), seed.fullVolume(), seed.geomJson());
      double lastVolume = insertLevels(seed);
      levelRows += ChronoUnit.DAYS.between(SEED_START, SEED_END) + 1;
      precipRows += insertPrecip(seed);
      insertForecast(seed, SEED_END.minusDays(7), lastVolume);
      insertForecast(seed, SEED_END, lastVolume);
    }
    log.info("Inserted {} reservoirs, {} level rows and {} precipitation rows", seeds.size(),
        levelRows, precipRows);
  }

  private double insertLevels(SeedReservoir seed) {
    List<Object[]> batchArgs = new ArrayList<>();
    double volume = 0;
    for (LocalDate date = SEED_START; !date.isAfter(SEED_END); date = date.plusDays(1)) {
      double seasonal = Math.sin(2.0 * Math.PI * (date.getDayOfYear() - 150) / 365.0);
      double fraction = seed.meanFill() + 0.35 * seasonal + random.nextGaussian() * 0.01;
      volume = round(seed.fullVolume() * Math.max(0.05, Math.min(1.0, fraction)), 4);
      batchArgs.add(new Object[]{seed.name(), Date.valueOf(date), volume});
    }
    jdbcTemplate.batchUpdate(
        "INSERT INTO reservoir_level(reservoir_name, obs_date, water_volume_bcm) VALUES (?, ?, ?)",
        batchArgs);
    return volume;
  }

  private int insertPrecip(SeedReservoir seed) {
    List<Object[]> batchArgs = new ArrayList<>();
    for (LocalDate date = SEED_START; !date.isAfter(SEED_END); date = date.plusDays(1)) {
      // monsoon peak around July
      double seasonal = Math.max(0.0, Math.sin(2.0 * Math.PI * (date.getDayOfYear() - 120) / 365.0));
      double precip = Math.max(0.0, seasonal * 12.0 + random.nextGaussian() * 3.0);
      batchArgs.add(new Object[]{seed.name(), Date.valueOf(date), round(precip, 2)});
    }
    jdbcTemplate.batchUpdate(
        "INSERT INTO reservoir_precip(reservoir_name, obs_date, precip_mm) VALUES (?, ?, ?)",
        batchArgs);
    return batchArgs.size();
  }

  private void insertForecast(SeedReservoir seed, LocalDate issueDate, double startVolume) {
    StringJoiner values = new StringJoiner(",", "{", "}");
    double volume = startVolume;
    for (int i = 0; i < FORECAST_DAYS; i++) {
      volume = Math.max(0.0, volume * (1.0 + random.nextGaussian() * 0.002) - 0.0005);
      values.add(Double.toString(round(volume, 4)));
    }
    Timestamp issuedAt = Timestamp.from(issueDate.atTime(6, 0).toInstant(ZoneOffset.UTC));
    jdbcTemplate.update(
        "INSERT INTO prediction(reservoir_name, issue_date, issued_at, forecast_bcm) "
            + "VALUES (?, ?, ?, CAST(? AS DOUBLE PRECISION[]))",
        seed.name(), Date.valueOf(issueDate), issuedAt, values.toString());
  }

  private static String square(double lon, double lat) {
    double d = 0.02;
    return String.format(Locale.ROOT,
        "{\"type\":\"Polygon\",\"coordinates\":[[[%.2f,%.2f],[%.2f,%.2f],[%.2f,%.2f],[%.2f,%.2f],[%.2f,%.2f]]]}",
        lon, lat, lon + d, lat, lon + d, lat + d, lon, lat + d, lon, lat);
  }

  private static double round(double value, int places) {
    double scale = Math.pow(10, places);
    return Math.round(value * scale) / scale;
  }

  private record SeedReservoir(String name, double fullVolume, double meanFill, String geomJson) {}
}
