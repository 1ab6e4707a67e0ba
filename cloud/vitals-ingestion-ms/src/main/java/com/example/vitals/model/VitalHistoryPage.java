package com.example.vitals.model;

import java.util.List;

public class VitalHistoryPage {
    public List<VitalReading> results;
    public int page;
    public int pageSize;
    public long total; // matching rows, ignoring pagination
}
