package com.example.bugservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The verification token is returned directly; mail delivery is external.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimCompanyResponse {

    private String message;
    private String verificationToken;
}
