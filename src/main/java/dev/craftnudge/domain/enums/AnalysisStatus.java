package dev.craftnudge.domain.enums;

public enum AnalysisStatus {
    OK, FAILED
}
