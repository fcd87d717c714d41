package com.example.bugservice.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Company wrapper, with a message when returned from verification.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompanyDetailResponse {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String message;

    private CompanyResponse company;
}
