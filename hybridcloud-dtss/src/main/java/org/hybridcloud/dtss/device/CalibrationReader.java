package org.hybridcloud.dtss.device;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the per-qubit calibration export of an IBM backend and averages its error columns
 * into an {@link ErrorProfile}.
 */
public final class CalibrationReader {
  private static final Logger LOG = Logger.getLogger(CalibrationReader.class.getName());

  public static final String READOUT_ERROR = "Readout assignment error";
  public static final String RX_ERROR = "RX error";
  public static final String PAULI_X_ERROR = "Pauli-X error";
  public static final String CZ_ERROR = "CZ error";
  public static final String ECR_ERROR = "ECR error";

  private CalibrationReader() {
  }

  /**
   * Reads a calibration export from the classpath.
   * @throws IllegalArgumentException if the resource is missing or lacks the error columns
   */
  public static ErrorProfile readResource(final String resource) {
    try (InputStream in = CalibrationReader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("Calibration resource not found: " + resource);
      }

      return read(new InputStreamReader(in, StandardCharsets.UTF_8), resource);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Parses a calibration export. Readout and single qubit errors are per-qubit columns;
   * two qubit errors are {@code "a_b:error;..."} lists where a pair listed more than once
   * keeps its last value.
   */
  public static ErrorProfile read(final Reader reader, final String source) throws IOException {
    final CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreSurroundingSpaces(true)
        .build();

    double readoutSum = 0;
    int readoutCount = 0;
    double singleSum = 0;
    int singleCount = 0;
    final Map<String, Double> pairErrors = new HashMap<>();

    try (CSVParser parser = format.parse(reader)) {
      final Map<String, Integer> header = parser.getHeaderMap();
      final String singleColumn = header.containsKey(RX_ERROR) ? RX_ERROR : PAULI_X_ERROR;
      final String pairColumn = header.containsKey(CZ_ERROR) ? CZ_ERROR : ECR_ERROR;
      if (!header.containsKey(READOUT_ERROR) || !header.containsKey(singleColumn)) {
        throw new IllegalArgumentException(MessageFormat.format(
            "Calibration {0} lacks the {1} or {2} column.", source, READOUT_ERROR, singleColumn));
      }

      for (final CSVRecord record : parser) {
        final Double readout = parseRate(record.get(READOUT_ERROR));
        if (readout != null) {
          readoutSum += readout;
          readoutCount++;
        }

        final Double single = parseRate(record.get(singleColumn));
        if (single != null) {
          singleSum += single;
          singleCount++;
        }

        if (header.containsKey(pairColumn)) {
          parsePairs(record.get(pairColumn), pairErrors);
        }
      }
    }

    if (readoutCount == 0 || singleCount == 0) {
      throw new IllegalArgumentException("Calibration " + source + " has no usable error rates.");
    }

    double pairSum = 0;
    for (final double error : pairErrors.values()) {
      pairSum += error;
    }

    final ErrorProfile profile = new ErrorProfile(
        singleSum / singleCount,
        readoutSum / readoutCount,
        pairErrors.isEmpty() ? 0 : pairSum / pairErrors.size());
    LOG.log(Level.FINE, () -> MessageFormat.format("Calibration {0}: {1}", source, profile));
    return profile;
  }

  private static Double parseRate(final String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }

    return Double.parseDouble(value);
  }

  private static void parsePairs(final String value, final Map<String, Double> pairErrors) {
    if (value == null || value.isEmpty()) {
      return;
    }

    for (final String entry : value.split(";")) {
      if (entry.trim().isEmpty()) {
        continue;
      }

      final String[] gateAndError = entry.split(":");
      if (gateAndError.length != 2) {
        throw new IllegalArgumentException("Malformed two qubit error entry: " + entry);
      }

      pairErrors.put(gateAndError[0].trim(), Double.parseDouble(gateAndError[1].trim()));
    }
  }
}
