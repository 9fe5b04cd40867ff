package com.krabby.auth.identity.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterParams {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "email address of the new account")
    @NotBlank
    @Email
    @Size(max = 64)
    private String email;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "name of the user")
    @NotBlank
    @Size(max = 64)
    private String fullName;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "password of the new account")
    @NotBlank
    @Size(min = 8, max = 128)
    @ToString.Exclude
    private String password;
}
