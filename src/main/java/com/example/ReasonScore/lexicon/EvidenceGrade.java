package com.example.ReasonScore.lexicon;

public enum EvidenceGrade {
    HIGH,
    MEDIUM,
    LOW
}
