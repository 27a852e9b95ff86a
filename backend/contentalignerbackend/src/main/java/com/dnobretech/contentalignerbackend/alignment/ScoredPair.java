package com.dnobretech.contentalignerbackend.alignment;

// candidato (i, j) com o cosseno da matriz; só existe durante a atribuição
public record ScoredPair(int referenceIndex, int targetIndex, double score) {}
