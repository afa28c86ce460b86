package com.example.portalsync.adapter.portal.extract;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.portalsync.domain.model.CourseView;
import org.junit.jupiter.api.Test;

import java.util.List;

class CourseMergerTest {

  @Test
  void fragmentsOfTheSameCourseAreMergedWithUnionOfWeeks() {
    List<CourseView> courses = CourseMerger.merge(List.of(
        new CourseFragment("高等数学", "张三", "A101", 1, 1, 2, "1-8(周)"),
        new CourseFragment("高等数学", "张三", "A101", 1, 1, 2, "6-12(周)")));

    assertThat(courses).hasSize(1);
    CourseView course = courses.get(0);
    assertThat(course.weeks()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
    assertThat(course.weekRange()).isEqualTo("1-8(周),6-12(周)");
  }

  @Test
  void differentLocationKeepsCoursesApart() {
    List<CourseView> courses = CourseMerger.merge(List.of(
        new CourseFragment("高等数学", "张三", "A101", 1, 1, 2, "1-8"),
        new CourseFragment("高等数学", "张三", "A102", 1, 1, 2, "9-16")));

    assertThat(courses).extracting(CourseView::location).containsExactly("A101", "A102");
  }

  @Test
  void nullTeacherAndLocationStillGroup() {
    List<CourseView> courses = CourseMerger.merge(List.of(
        new CourseFragment("体育", null, null, 5, 5, 6, "2"),
        new CourseFragment("体育", null, null, 5, 5, 6, "4")));

    assertThat(courses).singleElement().satisfies(course -> {
      assertThat(course.teacher()).isNull();
      assertThat(course.weeks()).containsExactly(2, 4);
    });
  }

  @Test
  void missingLabelMeansAllTwentyWeeksAndNoLabel() {
    List<CourseView> courses = CourseMerger.merge(List.of(
        new CourseFragment("讲座", "钱八", "礼堂", 3, 9, 10, null)));

    assertThat(courses.get(0).weekRange()).isNull();
    assertThat(courses.get(0).weeks()).hasSize(20);
  }

  @Test
  void repeatedIdenticalLabelIsListedOnce() {
    List<CourseView> courses = CourseMerger.merge(List.of(
        new CourseFragment("线性代数", "王五", "C303", 2, 1, 2, "1-16(周)"),
        new CourseFragment("线性代数", "王五", "C303", 2, 1, 2, "1-16(周)")));

    assertThat(courses.get(0).weekRange()).isEqualTo("1-16(周)");
  }
}
