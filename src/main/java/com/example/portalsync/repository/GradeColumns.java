package com.example.portalsync.repository;

import java.util.List;
import java.util.Map;

/**
 * Header aliases used to lift well-known columns out of a raw grade row.
 */
final class GradeColumns {

  static final List<String> COURSE_CODE = List.of("课程号", "课程代码", "课程编码", "课程编号");
  static final List<String> COURSE_NAME = List.of("课程名称", "课程名", "课程");
  static final List<String> CREDIT = List.of("学分", "课程学分");
  static final List<String> SCORE = List.of("成绩", "总评成绩", "最终成绩", "总成绩");
  static final List<String> GRADE_POINT = List.of("绩点", "GPA");

  private GradeColumns() {
  }

  static String pick(Map<String, String> row, List<String> aliases) {
    for (String alias : aliases) {
      String value = row.get(alias);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
