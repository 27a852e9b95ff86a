package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.enums.QualityBand;

// mesma régua pra tela, export e estatística
public final class QualityClassifier {

    public static final double HIGH_MIN = 0.8;
    public static final double MEDIUM_MIN = 0.6;
    public static final double LOW_MIN = 0.4;

    private QualityClassifier() {
    }

    public static QualityBand classify(Double score) {
        if (score == null || score.isNaN()) return QualityBand.POOR;
        if (score >= HIGH_MIN) return QualityBand.HIGH;
        if (score >= MEDIUM_MIN) return QualityBand.MEDIUM;
        if (score >= LOW_MIN) return QualityBand.LOW;
        return QualityBand.POOR;
    }
}
