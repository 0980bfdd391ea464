package com.example.dataaccess.core.registry;

import com.example.dataaccess.core.retry.Retry;

/**
 * Repositories over a master/slave pair: {@link #write()} targets the master, each call to {@link
 * #read()} targets the next slave.
 *
 * @param dataSources master and slaves
 * @param policy retry policy applied to every call
 */
public record MasterSlaveRepository(MasterSlaveDataSources dataSources, Retry.Policy policy) {

  public MasterSlaveRepository {
    if (dataSources == null) throw new IllegalArgumentException("dataSources must not be null");
    if (policy == null) throw new IllegalArgumentException("policy must not be null");
  }

  public Repository write() {
    return new Repository(dataSources.master(), policy);
  }

  public Repository read() {
    return new Repository(dataSources.slave(), policy);
  }
}
