package com.dnobretech.contentalignerbackend.dto;

import java.util.List;

// resposta do worker: POST /embed
public record EmbedResponse(String model, int dims, List<double[]> vectors) {
}
