package com.example.portalsync.adapter.portal.extract;

/**
 * Fields read out of one course fragment's markup.
 */
record FragmentFields(String name, String teacher, String weekRange, String location) {}
