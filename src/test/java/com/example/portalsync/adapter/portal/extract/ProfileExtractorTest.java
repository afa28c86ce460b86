package com.example.portalsync.adapter.portal.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.exception.SessionInvalidException;
import com.example.portalsync.support.Fixtures;
import com.example.portalsync.support.TestProperties;
import org.junit.jupiter.api.Test;

class ProfileExtractorTest {

  private final ProfileExtractor extractor = new ProfileExtractor(new LoginPageDetector(TestProperties.markers()));

  @Test
  void readsInlineAndAdjacentLabels() {
    Extraction<ProfileView> extraction = extractor.extract(Fixtures.read("profile.html"));

    assertThat(extraction.degraded()).isFalse();
    ProfileView profile = extraction.data();
    assertThat(profile.studentId()).isEqualTo("20210001");
    assertThat(profile.name()).isEqualTo("王小明");
    assertThat(profile.college()).isEqualTo("经济学院");
    assertThat(profile.major()).isEqualTo("金融学");
    assertThat(profile.className()).isEqualTo("金融2101");
    assertThat(profile.studyLevel()).isEqualTo("本科");
  }

  @Test
  void enrollmentDateIsReducedToYear() {
    assertThat(extractor.extract(Fixtures.read("profile.html")).data().enrollmentYear()).isEqualTo("2021");
  }

  @Test
  void unknownInlineLabelsAreKeptInRawFields() {
    ProfileView profile = extractor.extract(Fixtures.read("profile.html")).data();

    assertThat(profile.fields()).containsEntry("学制", "4");
  }

  @Test
  void pageWithoutLabelsIsDegraded() {
    Extraction<ProfileView> extraction = extractor.extract("<html><body><table><tr><td>--</td></tr></table></body></html>");

    assertThat(extraction.degraded()).isTrue();
    assertThat(extraction.data().studentId()).isNull();
  }

  @Test
  void loginPageMeansTheSessionIsGone() {
    assertThatThrownBy(() -> extractor.extract(Fixtures.read("login.html")))
        .isInstanceOf(SessionInvalidException.class);
  }
}
