package com.example.portalsync.adapter.portal.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.exception.SessionInvalidException;
import com.example.portalsync.support.Fixtures;
import com.example.portalsync.support.TestProperties;
import org.junit.jupiter.api.Test;

class GradeExtractorTest {

  private final GradeExtractor extractor = new GradeExtractor(new LoginPageDetector(TestProperties.markers()));

  @Test
  void rowsAreKeyedByHeader() {
    Extraction<GradeSheet> extraction = extractor.extract(Fixtures.read("grades.html"));

    assertThat(extraction.degraded()).isFalse();
    GradeSheet sheet = extraction.data();
    assertThat(sheet.headers()).startsWith("序号", "开课学期", "课程编号", "课程名称", "成绩");
    assertThat(sheet.rows()).hasSize(3);
    assertThat(sheet.rows().get(0))
        .containsEntry("课程编号", "MATH1001")
        .containsEntry("课程名称", "高等数学")
        .containsEntry("成绩", "92")
        .containsEntry("学分", "5");
    assertThat(sheet.rows().get(1)).containsEntry("成绩", "优秀");
  }

  @Test
  void blankHeaderGetsPositionalName() {
    GradeSheet sheet = extractor.extract(Fixtures.read("grades.html")).data();

    assertThat(sheet.headers()).hasSize(11).endsWith("col11");
    assertThat(sheet.rows().get(0)).containsEntry("col11", "");
  }

  @Test
  void duplicateHeadersAreSuffixed() {
    String html = "<table id=\"dataList\"><tr><th>成绩</th><th>成绩</th></tr>"
        + "<tr><td>90</td><td>85</td></tr></table>";

    GradeSheet sheet = extractor.extract(html).data();

    assertThat(sheet.headers()).containsExactly("成绩", "成绩_2");
    assertThat(sheet.rows().get(0)).containsEntry("成绩", "90").containsEntry("成绩_2", "85");
  }

  @Test
  void noDataPlaceholderRowIsSkipped() {
    String html = "<table id=\"dataList\"><tr><th>课程名称</th><th>成绩</th></tr>"
        + "<tr><td colspan=\"2\">未查询到数据</td></tr></table>";

    Extraction<GradeSheet> extraction = extractor.extract(html);

    assertThat(extraction.degraded()).isFalse();
    assertThat(extraction.data().rows()).isEmpty();
  }

  @Test
  void missingTableIsDegraded() {
    Extraction<GradeSheet> extraction = extractor.extract("<html><body>系统维护中</body></html>");

    assertThat(extraction.degraded()).isTrue();
    assertThat(extraction.data().rows()).isEmpty();
  }

  @Test
  void loginPageMeansTheSessionIsGone() {
    assertThatThrownBy(() -> extractor.extract(Fixtures.read("login.html")))
        .isInstanceOf(SessionInvalidException.class);
  }
}
