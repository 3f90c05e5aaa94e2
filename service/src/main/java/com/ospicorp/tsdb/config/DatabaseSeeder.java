package com.ospicorp.tsdb.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.ospicorp.tsdb.database.service.DatabaseService;
import com.ospicorp.tsdb.series.model.SeriesWrite;
import com.ospicorp.tsdb.series.model.TimePrecision;
import com.ospicorp.tsdb.series.model.WriteSummary;
import com.ospicorp.tsdb.series.service.SeriesService;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/** Fills a {@code demo} database with a few hours of host metrics for local exploration. */
@Component
public class DatabaseSeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(DatabaseSeeder.class);
  static final String DEMO_DATABASE = "demo";
  private static final Duration SPAN = Duration.ofHours(6);
  private static final Duration STEP = Duration.ofMinutes(1);
  private static final String HOST = "web-01";
  private static final List<String> CPUS = List.of("cpu-total", "cpu0", "cpu1");
  private static final List<String> DEVICES = List.of("disk1s1", "disk1s5");
  private static final List<String> EMAILS =
      List.of("paul@example.com", "todd@example.com", "ana@example.com");

  private final DatabaseService databases;
  private final SeriesService seriesService;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Environment environment;
  private final boolean seedEnabled;
  private final Random random = new Random(8675309L);

  public DatabaseSeeder(DatabaseService databases,
      SeriesService seriesService,
      ObjectMapper objectMapper,
      Clock clock,
      Environment environment,
      @Value("${tsdb.seed.enabled:false}") boolean seedEnabled) {
    this.databases = databases;
    this.seriesService = seriesService;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.environment = environment;
    this.seedEnabled = seedEnabled;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Database seeding disabled via property tsdb.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping database seeding because active profile includes prod");
      return;
    }
    boolean exists = databases.list().stream()
        .anyMatch(database -> DEMO_DATABASE.equals(database.name()));
    if (exists) {
      log.info("Database {} already exists; skipping seeding", DEMO_DATABASE);
      return;
    }
    seedDatabase();
  }

  void seedDatabase() {
    log.info("Seeding database {} with host metrics", DEMO_DATABASE);
    databases.create(DEMO_DATABASE);
    long end = clock.millis();
    long start = end - SPAN.toMillis();
    List<SeriesWrite> writes = List.of(
        cpu(start, end),
        memory(start, end),
        disk(start, end),
        events(start, end));
    WriteSummary summary = seriesService.write(DEMO_DATABASE, writes, TimePrecision.MS);
    log.info("Inserted {} points into {} series", summary.points(), summary.series());
  }

  private SeriesWrite cpu(long start, long end) {
    List<JsonNode> points = new ArrayList<>();
    for (long time = start; time <= end; time += STEP.toMillis()) {
      for (String cpu : CPUS) {
        double user = round(wave(time, 20.0, 12.0) + noise(3.0));
        double system = round(Math.max(0.0, 6.0 + noise(2.0)));
        double idle = round(Math.max(0.0, 100.0 - user - system));
        points.add(row(time, idle, user, system, HOST, cpu));
      }
    }
    return new SeriesWrite("cpu", List.of("time", "usage_idle", "usage_user", "usage_system",
        "host", "cpu"), null, points);
  }

  private SeriesWrite memory(long start, long end) {
    List<JsonNode> points = new ArrayList<>();
    long total = 17_179_869_184L;
    for (long time = start; time <= end; time += STEP.toMillis()) {
      double usedPercent = round(wave(time, 62.0, 8.0) + noise(1.5));
      long used = (long) (total * usedPercent / 100.0);
      points.add(row(time, usedPercent, used, total, HOST));
    }
    return new SeriesWrite("mem", List.of("time", "used_percent", "used", "total", "host"),
        null, points);
  }

  private SeriesWrite disk(long start, long end) {
    List<JsonNode> points = new ArrayList<>();
    int index = 0;
    for (String device : DEVICES) {
      double base = 40.0 + 25.0 * index++;
      for (long time = start; time <= end; time += STEP.toMillis() * 5) {
        double growth = (time - start) / (double) SPAN.toMillis();
        points.add(row(time, round(base + growth + noise(0.1)), device, "apfs", HOST));
      }
    }
    return new SeriesWrite("disk", List.of("time", "used_percent", "device", "fstype", "host"),
        null, points);
  }

  private SeriesWrite events(long start, long end) {
    List<JsonNode> points = new ArrayList<>();
    for (long time = start; time <= end; time += STEP.toMillis() * 3) {
      String email = EMAILS.get(random.nextInt(EMAILS.size()));
      String type = random.nextInt(4) == 0 ? "login" : "click";
      points.add(row(time, email, type));
    }
    return new SeriesWrite("users.events", null, List.of("email", "type"), points);
  }

  private JsonNode row(Object... values) {
    ArrayNode row = objectMapper.createArrayNode();
    for (Object value : values) {
      row.add(objectMapper.valueToTree(value));
    }
    return row;
  }

  private double wave(long time, double base, double amplitude) {
    long hour = Duration.ofHours(1).toMillis();
    double phase = (time % hour) / (double) hour;
    return base + amplitude * Math.sin(2.0 * Math.PI * phase);
  }

  private double noise(double amplitude) {
    return random.nextGaussian() * amplitude;
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
