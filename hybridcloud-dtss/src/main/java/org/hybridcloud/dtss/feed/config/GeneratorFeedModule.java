package org.hybridcloud.dtss.feed.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;
import com.google.inject.util.Providers;
import org.hybridcloud.dtss.config.parameters.JobArrivalRate;
import org.hybridcloud.dtss.config.parameters.MaxJobs;
import org.hybridcloud.dtss.feed.GeneratorJobFeed;
import org.hybridcloud.dtss.feed.JobFeed;

import javax.annotation.Nullable;

/**
 * Configurations associated with generating random jobs.
 */
public final class GeneratorFeedModule extends AbstractModule {
  public static final String METHOD = GeneratorJobFeed.METHOD;

  private Double arrivalRate = GeneratorJobFeed.DEFAULT_ARRIVAL_RATE;

  private Integer maxJobs = null;

  private GeneratorFeedModule() {
  }

  @VisibleForTesting
  public static GeneratorFeedModule newModule(final double arrivalRate, @Nullable final Integer maxJobs) {
    final GeneratorFeedModule m = new GeneratorFeedModule();
    m.arrivalRate = arrivalRate;
    m.maxJobs = maxJobs;
    return m;
  }

  @Override
  protected void configure() {
    bind(JobFeed.class).to(GeneratorJobFeed.class);
    bind(Double.class).annotatedWith(JobArrivalRate.class).toProvider(Providers.of(arrivalRate));
    bind(Integer.class).annotatedWith(MaxJobs.class).toProvider(Providers.of(maxJobs));
  }

  @Nullable
  public Integer getMaxJobs() {
    return maxJobs;
  }
}
