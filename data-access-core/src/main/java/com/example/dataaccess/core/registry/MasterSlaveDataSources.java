package com.example.dataaccess.core.registry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;

/**
 * A master data source for writes and zero or more slaves for reads. Reads rotate over the slaves
 * round-robin and fall back to the master when there are none.
 */
public final class MasterSlaveDataSources {

  private final DataSource master;
  private final List<DataSource> slaves;
  private final AtomicInteger next = new AtomicInteger();

  public MasterSlaveDataSources(final DataSource master, final List<DataSource> slaves) {
    if (master == null) throw new IllegalArgumentException("master must not be null");
    if (slaves == null || slaves.stream().anyMatch(Objects::isNull))
      throw new IllegalArgumentException("slaves must not be null or contain null");
    this.master = master;
    this.slaves = List.copyOf(slaves);
  }

  public DataSource master() {
    return master;
  }

  public List<DataSource> slaves() {
    return slaves;
  }

  /**
   * Picks the data source for the next read.
   *
   * @return next slave, or the master when no slaves are configured
   */
  public DataSource slave() {
    if (slaves.isEmpty()) return master;
    return slaves.get(Math.floorMod(next.getAndIncrement(), slaves.size()));
  }
}
