package org.hybridcloud.dtss.stats;

import org.apache.commons.math3.util.Precision;
import org.hybridcloud.dtss.device.QuantumDevice;
import org.hybridcloud.dtss.job.JobPhase;
import org.hybridcloud.dtss.metrics.MetricsConfiguration;
import org.hybridcloud.dtss.metrics.job.JobEndState;
import org.hybridcloud.dtss.metrics.job.JobRecordLedger;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

public class TestJobStats {
  private JobRecordLedger ledger;
  private JobStats jobStats;

  @Before
  public void setup() {
    final MetricsConfiguration metricsConfig = MetricsConfiguration.metricsOff();
    ledger = new JobRecordLedger(metricsConfig);
    jobStats = new JobStats(metricsConfig, ledger);
  }

  private void completeJob(final int jobId, final double arrival, final double makespan, final int iterations) {
    ledger.onJobArrived(jobId);
    ledger.logJobEvent(jobId, JobRecordLedger.ARRIVAL_EVENT, arrival);
    for (int i = 0; i < iterations; i++) {
      ledger.logJobEvent(jobId, QuantumDevice.FIDELITY_EVENT, 0.9 - i * 0.1);
      ledger.logJobEvent(jobId, JobPhase.CPU.finishEvent(), arrival + makespan * (i + 1) / iterations);
    }
    ledger.logJobEvent(jobId, JobRecordLedger.MAKESPAN_EVENT, makespan);
    ledger.onJobCompleted(jobId);
  }

  @Test
  public void testSummariesFollowTheLedger() {
    completeJob(1, 0D, 12D, 2);
    completeJob(2, 1.5, 4D, 1);
    ledger.onJobArrived(3);
    ledger.logJobEvent(3, JobRecordLedger.ARRIVAL_EVENT, 2D);
    ledger.onJobArrived(4);
    ledger.onJobFailed(4, new IllegalStateException("no devices"));

    final List<JobStats.JobSummary> summaries = jobStats.getSummaries();
    Assert.assertEquals(4, summaries.size());

    final JobStats.JobSummary first = summaries.get(0);
    Assert.assertEquals(1, first.getJobId());
    Assert.assertEquals(2, first.getIterations());
    Assert.assertEquals(12D, first.getMakespan(), 0D);

    // The last fidelity is reported
    Assert.assertEquals(0.8, first.getFidelity(), 1e-12);

    final JobStats.JobSummary unfinished = summaries.get(2);
    Assert.assertEquals(2D, unfinished.getArrival(), 0D);
    Assert.assertNull(unfinished.getMakespan());
    Assert.assertNull(unfinished.getFidelity());
    Assert.assertEquals(0, unfinished.getIterations());
    Assert.assertEquals(JobEndState.IN_PROGRESS, unfinished.getEndState());

    Assert.assertEquals(2, jobStats.countJobs(JobEndState.COMPLETED));
    Assert.assertEquals(1, jobStats.countJobs(JobEndState.IN_PROGRESS));
    Assert.assertEquals(1, jobStats.countJobs(JobEndState.FAILED));

    final String table = jobStats.toString();
    Assert.assertTrue(table.startsWith("JobId, Arrival, Iterations, Makespan, Fidelity, EndState"));
    Assert.assertTrue(table.contains("Failed jobs: 1, unfinished jobs: 1"));
  }

  @Test
  public void testMakespanStatsOnlyCountCompletedJobs() {
    Assert.assertNull(jobStats.getMakespanStats());

    completeJob(1, 0D, 2D, 1);
    completeJob(2, 0D, 4D, 1);
    completeJob(3, 0D, 9D, 1);
    ledger.onJobArrived(4);

    final StatUtils stats = jobStats.getMakespanStats();
    Assert.assertNotNull(stats);
    Assert.assertEquals(3, stats.getSize());
    Assert.assertTrue(Precision.equals(5D, stats.getMean()));
    Assert.assertTrue(Precision.equals(4D, stats.getMedian()));
    Assert.assertTrue(Precision.equals(Math.sqrt(26D / 3), stats.getStdDev(), 1e-12));
  }

  @Test
  public void testMedianOfAnEvenSample() {
    final StatUtils stats = new StatUtils(new double[] {7D, 1D, 3D, 5D});
    Assert.assertTrue(Precision.equals(4D, stats.getMedian()));
    Assert.assertTrue(Precision.equals(5D, stats.getVariance()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptySampleIsRejected() {
    new StatUtils(new double[0]);
  }
}
