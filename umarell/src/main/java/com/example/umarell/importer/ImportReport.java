package com.example.umarell.importer;

import java.util.List;

public record ImportReport(int upserted, int matched, int placeholders, List<String> placeholderKeys) {}
