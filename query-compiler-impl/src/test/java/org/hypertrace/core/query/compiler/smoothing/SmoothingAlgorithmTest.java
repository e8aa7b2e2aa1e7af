package org.hypertrace.core.query.compiler.smoothing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.hypertrace.core.query.compiler.InvalidQueryConfigurationException;
import org.junit.jupiter.api.Test;

class SmoothingAlgorithmTest {

  @Test
  void resolvesAlgorithmByName() {
    assertEquals(Optional.of(SmoothingAlgorithm.EWMA), SmoothingAlgorithm.fromName("ewma"));
    assertEquals(Optional.of(SmoothingAlgorithm.AUTO), SmoothingAlgorithm.fromName("auto"));
    assertEquals(Optional.of(SmoothingAlgorithm.MEDIAN), SmoothingAlgorithm.fromName("median"));
    assertEquals(Optional.empty(), SmoothingAlgorithm.fromName("loess"));
    assertEquals(Optional.empty(), SmoothingAlgorithm.fromName(null));
  }

  @Test
  void translatesWeightIndexPerAlgorithm() {
    assertEquals("0.7", SmoothingAlgorithm.EWMA.translateWeight("0"));
    assertEquals("0.5", SmoothingAlgorithm.EWMA.translateWeight("1"));
    assertEquals("0.1", SmoothingAlgorithm.EWMA.translateWeight("3"));
    assertEquals("3", SmoothingAlgorithm.MEDIAN.translateWeight("0"));
    assertEquals("7", SmoothingAlgorithm.MEDIAN.translateWeight(" 2 "));
  }

  @Test
  void rejectsWeightIndexOutOfRange() {
    InvalidQueryConfigurationException exception =
        assertThrows(
            InvalidQueryConfigurationException.class,
            () -> SmoothingAlgorithm.EWMA.translateWeight("4"));
    assertTrue(exception.getMessage().startsWith("Invalid configuration"));

    assertThrows(
        InvalidQueryConfigurationException.class,
        () -> SmoothingAlgorithm.MEDIAN.translateWeight("-1"));
  }

  @Test
  void rejectsNonNumericWeight() {
    assertThrows(
        InvalidQueryConfigurationException.class,
        () -> SmoothingAlgorithm.EWMA.translateWeight("high"));
    assertThrows(
        InvalidQueryConfigurationException.class,
        () -> SmoothingAlgorithm.EWMA.translateWeight(null));
  }

  @Test
  void autoHasNoWeights() {
    assertThrows(
        InvalidQueryConfigurationException.class,
        () -> SmoothingAlgorithm.AUTO.translateWeight("0"));
  }
}
