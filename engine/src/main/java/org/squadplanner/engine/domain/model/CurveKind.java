package org.squadplanner.engine.domain.model;

public enum CurveKind {
    LOGISTIC,
    LINEAR,
    PIECEWISE_LINEAR
}
