package com.podshift.dependency.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"severity", "code", "source", "subject", "message"})
public class DiagnosticView {
    private String severity;
    private String code;
    private String source;
    private String subject;
    private String message;
}
