package org.hybridcloud.dtss.feed.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;
import com.google.inject.util.Providers;
import org.hybridcloud.dtss.config.parameters.DispatcherFilePath;
import org.hybridcloud.dtss.feed.DispatcherJobFeed;
import org.hybridcloud.dtss.feed.JobFeed;

/**
 * Configurations associated with dispatching jobs from a file.
 */
public final class DispatcherFeedModule extends AbstractModule {
  public static final String METHOD = DispatcherJobFeed.METHOD;

  private String filePath = null;

  private DispatcherFeedModule() {
  }

  @VisibleForTesting
  public static DispatcherFeedModule newModule(final String filePath) {
    final DispatcherFeedModule m = new DispatcherFeedModule();
    m.filePath = filePath;
    return m;
  }

  @Override
  protected void configure() {
    bind(JobFeed.class).to(DispatcherJobFeed.class);
    bind(String.class).annotatedWith(DispatcherFilePath.class).toProvider(Providers.of(filePath));
  }

  public String getFilePath() {
    return filePath;
  }
}
