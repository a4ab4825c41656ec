package org.hybridcloud.dtss.device;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;

public class TestCalibrationReader {
  @Test
  public void testAveragesUsePreferredColumns() throws IOException {
    final String csv = "Qubit,Readout assignment error,Pauli-X error,RX error,CZ error,ECR error\n"
        + "0,0.01,0.5,0.001,\"0_1:0.02;0_2:0.004\",0_1:0.9\n"
        + "1,0.03,0.5,0.003,1_0:0.006,1_0:0.9\n"
        + "2,,0.5,,0_1:0.01,\n";

    final ErrorProfile errors = CalibrationReader.read(new StringReader(csv), "inline");
    Assert.assertEquals(0.02, errors.getAvgReadoutError(), 1e-12);
    Assert.assertEquals(0.002, errors.getAvgSingleQubitError(), 1e-12);

    // 0_1 keeps its last value, 1_0 counts as its own pair
    Assert.assertEquals((0.01 + 0.004 + 0.006) / 3, errors.getAvgTwoQubitError(), 1e-12);
  }

  @Test
  public void testFallsBackToPauliAndEcrColumns() throws IOException {
    final String csv = "Qubit,Readout assignment error,Pauli-X error,ECR error\n"
        + "0,0.02,0.0004,0_1:0.008\n"
        + "1,0.04,0.0002,\n";

    final ErrorProfile errors = CalibrationReader.read(new StringReader(csv), "inline");
    Assert.assertEquals(0.03, errors.getAvgReadoutError(), 1e-12);
    Assert.assertEquals(0.0003, errors.getAvgSingleQubitError(), 1e-12);
    Assert.assertEquals(0.008, errors.getAvgTwoQubitError(), 1e-12);
  }

  @Test
  public void testMissingTwoQubitColumnMeansNoTwoQubitError() throws IOException {
    final String csv = "Qubit,Readout assignment error,RX error\n0,0.02,0.001\n";
    Assert.assertEquals(0D, CalibrationReader.read(new StringReader(csv), "inline").getAvgTwoQubitError(), 0D);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingReadoutColumnIsRejected() throws IOException {
    CalibrationReader.read(new StringReader("Qubit,RX error\n0,0.001\n"), "inline");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedPairIsRejected() throws IOException {
    CalibrationReader.read(new StringReader(
        "Qubit,Readout assignment error,RX error,CZ error\n0,0.02,0.001,0_1\n"), "inline");
  }

  @Test
  public void testBundledSample() {
    final ErrorProfile errors = CalibrationReader.readResource("calibration/ibm_fez_sample.csv");
    Assert.assertTrue(errors.getAvgReadoutError() < 0.1);
    Assert.assertTrue(errors.getAvgSingleQubitError() < 0.01);
    Assert.assertTrue(errors.getAvgTwoQubitError() < 0.05);
  }
}
