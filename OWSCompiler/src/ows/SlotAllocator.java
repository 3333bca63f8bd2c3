package ows;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Hands out array indices for stored variables, one counter per address space.
 *
 * <p>One allocator serves a whole compilation, so indices are never reused across rules.
 */
public final class SlotAllocator {
  private static final Logger LOG = Logger.getLogger(SlotAllocator.class.getName());

  private final Map<Symbol.Domain, Integer> next = new EnumMap<>(Symbol.Domain.class);

  public int allocate(Symbol.Domain domain, String owner) {
    int index = count(domain);
    next.put(domain, index + 1);
    LOG.fine(() -> String.format("allocated %s slot %d for '%s'", domain, index, owner));
    return index;
  }

  public int count(Symbol.Domain domain) {
    return next.getOrDefault(domain, 0);
  }
}
