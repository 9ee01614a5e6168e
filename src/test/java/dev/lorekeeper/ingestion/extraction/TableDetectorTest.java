package dev.lorekeeper.ingestion.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TableDetectorTest {

  @Test
  void threeConsecutiveTabbedLinesAreATable() {
    String text = "Weapon\tDamage\nDagger\t1d4\nSword\t1d8\nAfterwards prose.";

    assertThat(TableDetector.containsTable(text)).isTrue();
  }

  @Test
  void runsOfSpacesCountAsColumnGaps() {
    String text = "Name     Cost\nRope     1 gp\nTorch    1 cp";

    assertThat(TableDetector.containsTable(text)).isTrue();
  }

  @Test
  void twoTabbedLinesAreNotEnough() {
    String text = "A\tB\nC\tD\nplain line\nE\tF";

    assertThat(TableDetector.containsTable(text)).isFalse();
  }

  @Test
  void ordinaryProseIsNotATable() {
    assertThat(TableDetector.containsTable("One line.\nAnother line.\nA third.")).isFalse();
  }
}
