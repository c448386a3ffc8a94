package com.ospicorp.nitrateforecast.forecast.model;

import com.ospicorp.nitrateforecast.features.model.CorrelationPoint;
import java.util.List;

public record ResidualDiagnostics(
    int residualCount,
    double residualMean,
    double residualStdDev,
    List<CorrelationPoint> residualAcf,
    double ljungBoxQ,
    int ljungBoxLags,
    double ljungBoxPValue,
    double jarqueBera,
    double jarqueBeraPValue,
    double skewness,
    double excessKurtosis,
    double heteroskedasticityRatio
) {}
