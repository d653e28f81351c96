package com.agri.model;

import java.time.Instant;
import java.util.Map;

/**
 * Сводка для GET /api/status: датчики, роверы, команды по состояниям и сведения о процессе.
 */
public final class SystemStatus {

  private final Probes probes;
  private final Counts rovers;
  private final Counts commands;
  private final Service system;

  public SystemStatus(Probes probes, Counts rovers, Counts commands, Service system) {
    this.probes = probes;
    this.rovers = rovers;
    this.commands = commands;
    this.system = system;
  }

  public Probes getProbes() {
    return probes;
  }

  public Counts getRovers() {
    return rovers;
  }

  public Counts getCommands() {
    return commands;
  }

  public Service getSystem() {
    return system;
  }

  public static final class Probes {
    private final int configured;
    private final int reporting;
    private final Instant lastUpdate;

    public Probes(int configured, int reporting, Instant lastUpdate) {
      this.configured = configured;
      this.reporting = reporting;
      this.lastUpdate = lastUpdate;
    }

    public int getConfigured() {
      return configured;
    }

    /** Датчики, у которых есть хотя бы одно сохранённое показание. */
    public int getReporting() {
      return reporting;
    }

    public Instant getLastUpdate() {
      return lastUpdate;
    }
  }

  public static final class Counts {
    private final long total;
    private final Map<String, Long> byStatus;

    public Counts(long total, Map<String, Long> byStatus) {
      this.total = total;
      this.byStatus = Map.copyOf(byStatus);
    }

    public long getTotal() {
      return total;
    }

    public Map<String, Long> getByStatus() {
      return byStatus;
    }
  }

  public static final class Service {
    private final String status;
    private final String version;
    private final long uptimeSeconds;

    public Service(String status, String version, long uptimeSeconds) {
      this.status = status;
      this.version = version;
      this.uptimeSeconds = uptimeSeconds;
    }

    public String getStatus() {
      return status;
    }

    public String getVersion() {
      return version;
    }

    public long getUptimeSeconds() {
      return uptimeSeconds;
    }
  }
}
