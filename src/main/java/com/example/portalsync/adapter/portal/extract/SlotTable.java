package com.example.portalsync.adapter.portal.extract;

import java.util.List;
import java.util.Optional;

/**
 * Maps the zero-based index of a timetable data row to its (start, end) section pair.
 */
public final class SlotTable {

  private static final SlotTable STANDARD = new SlotTable(List.of(
      new int[] {1, 2},
      new int[] {3, 4},
      new int[] {5, 6},
      new int[] {7, 8},
      new int[] {9, 10},
      new int[] {11, 12}));

  private final List<int[]> slots;

  public SlotTable(List<int[]> slots) {
    this.slots = List.copyOf(slots);
  }

  public static SlotTable standard() {
    return STANDARD;
  }

  public Optional<int[]> slotsFor(int dataRowIndex) {
    if (dataRowIndex < 0 || dataRowIndex >= slots.size()) {
      return Optional.empty();
    }
    return Optional.of(slots.get(dataRowIndex));
  }
}
