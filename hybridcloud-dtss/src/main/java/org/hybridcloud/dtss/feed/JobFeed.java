package org.hybridcloud.dtss.feed;

import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.broker.BrokerFactory;
import org.hybridcloud.dtss.job.QuantumJob;
import org.hybridcloud.dtss.lifecycle.LifeCycle;
import org.hybridcloud.dtss.lifecycle.LifeCycleState;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.hybridcloud.dtss.time.Clock;

import java.text.MessageFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An abstraction for job feeds.
 * Works with the simulation environment through the function areFeedJobsDone
 * to determine whether or not every job of the feed has completed.
 */
public abstract class JobFeed extends LifeCycle {
  private static final Logger LOG = Logger.getLogger(JobFeed.class.getName());

  protected final Clock clock;
  protected final JobRecordLedger ledger;
  private final BrokerFactory brokerFactory;

  // Jobs whose broker has not finished yet
  private final Map<QuantumJob, CompletableFuture<Void>> inFlight = new LinkedHashMap<>();
  private int dispatchedCount = 0;

  protected JobFeed(final Clock clock, final JobRecordLedger ledger, final BrokerFactory brokerFactory) {
    this.clock = clock;
    this.ledger = ledger;
    this.brokerFactory = brokerFactory;
  }

  /**
   * Records the arrival of {@code job} and hands it to a new broker.
   */
  protected void dispatch(final QuantumJob job) {
    final int jobId = job.getJobId();
    ledger.onJobArrived(jobId);
    ledger.logJobEvent(jobId, JobRecordLedger.ARRIVAL_EVENT, Precision.round(clock.getTime(), 4));
    LOG.log(Level.FINE, () -> MessageFormat.format("{0}: dispatching {1}.", clock.getTime(), job));
    dispatchedCount++;

    final CompletableFuture<Void> done = brokerFactory.newBroker(job).run();
    inFlight.put(job, done);
    done.whenComplete((v, e) -> {
      inFlight.remove(job);
      if (e == null) {
        ledger.onJobCompleted(jobId);
      } else {
        ledger.onJobFailed(jobId, e);
      }
    });
  }

  /**
   * @return whether the feed will not produce any more jobs
   */
  protected abstract boolean isExhausted();

  /**
   * Checked periodically by the simulation environment.
   * @return whether the feed is exhausted and every dispatched job is done
   */
  public boolean areFeedJobsDone() {
    if (getState().isDone()) {
      return true;
    }

    if (getState() != LifeCycleState.STARTED) {
      return false;
    }

    return isExhausted() && inFlight.isEmpty();
  }

  /**
   * Called once the clock stopped. Jobs still running keep their in-progress state.
   */
  public void onStop() {
    for (final QuantumJob job : inFlight.keySet()) {
      LOG.log(Level.WARNING, MessageFormat.format(
          "Job {0} did not finish before the simulation ended (phase {1}, iteration {2}/{3}).",
          job.getJobId(), job.getPhase(), job.getIteration(), job.getIterations()));
    }
  }

  public int getDispatchedCount() {
    return dispatchedCount;
  }

  public int getInFlightCount() {
    return inFlight.size();
  }
}
