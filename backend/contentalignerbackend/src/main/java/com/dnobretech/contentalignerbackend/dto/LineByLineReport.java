package com.dnobretech.contentalignerbackend.dto;

import java.util.List;

public record LineByLineReport(List<LineByLineDiagnostic> diagnostics, AlignmentStatistics statistics) {}
