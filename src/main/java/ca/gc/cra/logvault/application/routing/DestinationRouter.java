package ca.gc.cra.logvault.application.routing;

import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.EntryKind;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Selects the destinations an entry is written to.
 * <p><strong>Why:</strong> Keeps the routing table declarative; the sink only iterates the answer.</p>
 * <p><strong>Role:</strong> Consulted by {@code DestinationSink} once per entry.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Application receives every entry.</li>
 *   <li>Error receives entries at {@link LogLevel#ERROR} or above.</li>
 *   <li>Access and metrics receive only entries tagged with the matching {@link EntryKind}.</li>
 *   <li>Destinations that are not enabled are never returned.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; routes are precomputed per level and kind.</p>
 * <p><strong>Performance:</strong> One map lookup per entry; no allocation.</p>
 *
 * @since 0.1.0
 */
public final class DestinationRouter {
  private static final List<Rule> RULES = List.of(
      new Rule(Destination.APPLICATION, null, null),
      new Rule(Destination.ACCESS, null, EntryKind.ACCESS),
      new Rule(Destination.ERROR, LogLevel.ERROR, null),
      new Rule(Destination.METRICS, null, EntryKind.METRICS));

  private final Set<Destination> enabled;
  private final Map<EntryKind, Map<LogLevel, List<Destination>>> routes = new EnumMap<>(EntryKind.class);

  /**
   * Builds the routing table for the enabled destinations.
   *
   * @param enabled destinations with a writer; the application destination must be present
   * @throws IllegalArgumentException if the application destination is missing
   */
  public DestinationRouter(Set<Destination> enabled) {
    Objects.requireNonNull(enabled, "enabled");
    if (!enabled.contains(Destination.APPLICATION)) {
      throw new IllegalArgumentException("application destination must be enabled");
    }
    this.enabled = Collections.unmodifiableSet(EnumSet.copyOf(enabled));
    for (EntryKind kind : EntryKind.values()) {
      Map<LogLevel, List<Destination>> byLevel = new EnumMap<>(LogLevel.class);
      for (LogLevel level : LogLevel.values()) {
        List<Destination> selected = new ArrayList<>(RULES.size());
        for (Rule rule : RULES) {
          if (this.enabled.contains(rule.destination()) && rule.matches(level, kind)) {
            selected.add(rule.destination());
          }
        }
        byLevel.put(level, List.copyOf(selected));
      }
      routes.put(kind, byLevel);
    }
  }

  /**
   * Routes everything to the application destination only.
   *
   * @return router with separation disabled
   */
  public static DestinationRouter applicationOnly() {
    return new DestinationRouter(EnumSet.of(Destination.APPLICATION));
  }

  public Set<Destination> enabled() {
    return enabled;
  }

  /**
   * Returns the destinations for one entry in rule order; application always comes first.
   *
   * @param entry entry to route
   * @return immutable destination list
   */
  public List<Destination> route(LogEntry entry) {
    return route(entry.level(), entry.kind());
  }

  /**
   * Returns the destinations for a level and kind.
   *
   * @param level entry level
   * @param kind entry tag
   * @return immutable destination list
   */
  public List<Destination> route(LogLevel level, EntryKind kind) {
    return routes.get(kind).get(level);
  }

  private record Rule(Destination destination, LogLevel minimumLevel, EntryKind requiredKind) {
    boolean matches(LogLevel level, EntryKind kind) {
      if (minimumLevel != null && !level.isAtLeast(minimumLevel)) {
        return false;
      }
      return requiredKind == null || requiredKind == kind;
    }
  }
}
