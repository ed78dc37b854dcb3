package com.fintech.resolution.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DisputeRequest {

    @NotBlank
    @Size(max = 64)
    private String transactionId;

    @NotBlank
    @Size(max = 2000)
    private String complaint;
}
