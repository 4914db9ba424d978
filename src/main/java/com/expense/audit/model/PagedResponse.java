package com.expense.audit.model;

import java.util.List;

public record PagedResponse<T>(List<T> data, int total, boolean hasMore) {}
