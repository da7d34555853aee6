package com.flamingo.ai.chartreader.service.pdf;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PageScorer Tests")
class PageScorerTest {

  private final PageScorer scorer = new PageScorer();

  @Test
  @DisplayName("Dance/disco chart page should beat the same page headed as a rock chart")
  void shouldPreferDanceDiscoChart_overOtherChart() {
    PageScore dance = scorer.score(chartPage("HOT DANCE/DISCO", 80));
    PageScore rock = scorer.score(chartPage("HOT ROCK TRACKS", 80));

    assertThat(dance.preferenceBoost()).isPositive();
    assertThat(rock.preferenceBoost()).isZero();
    assertThat(dance.effectiveScore()).isGreaterThan(rock.effectiveScore());
    assertThat(scorer.looksLikeChartPage(dance)).isTrue();
    assertThat(scorer.looksLikeChartPage(rock)).isTrue();
  }

  @Test
  @DisplayName("Prose mentioning dance and disco should earn no boost")
  void shouldNotBoostProse() {
    PageScore prose =
        scorer.score(
            "The story of dance and disco culture in the seventies was written in clubs by DJs"
                + " who played records long into the night, long before anybody printed a list.");

    assertThat(prose.preferenceBoost()).isZero();
    assertThat(prose.baseScore()).isLessThan(PageScorer.BOOST_GATE_BASE);
    assertThat(scorer.looksLikeChartPage(prose)).isFalse();
  }

  @Test
  void shouldBoostTwelveInchAbbreviation_onlyWhenJoinedToNextWord() {
    PageScore joined = scorer.score(chartPage("HOT ROCK TRACKS 12 IN.SINGLES", 80));
    PageScore spaced = scorer.score(chartPage("HOT ROCK TRACKS 12 IN. SINGLES", 80));

    assertThat(joined.preferenceBoost()).isEqualTo(900);
    assertThat(spaced.preferenceBoost()).isZero();
  }

  @Test
  void shouldScoreZero_whenTextBlank() {
    assertThat(scorer.score("   ")).isEqualTo(PageScore.EMPTY);
    assertThat(scorer.score(null)).isEqualTo(PageScore.EMPTY);
  }

  @Test
  void shouldCountOnlyRankLikeNumbers() {
    PageScore score = scorer.score("1 2 3 250 1979 0 200");

    assertThat(score.rankCount()).isEqualTo(4);
  }

  static String chartPage(String header, int entries) {
    StringBuilder text = new StringBuilder(header);
    text.append("\nTHIS WEEK LAST WEEK WEEKS ON CHART TITLE ARTIST LABEL\n");
    for (int rank = 1; rank <= entries; rank++) {
      text.append(rank).append(" SONG TITLE Artist Name (Label)\n");
    }
    return text.toString();
  }
}
