package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.graph.DependencyEdge;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExtractionResult {

    String extractor;

    @Singular
    List<DependencyEdge> edges;

    @Singular
    List<Diagnostic> diagnostics;
}
