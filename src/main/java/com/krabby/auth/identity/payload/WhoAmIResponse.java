package com.krabby.auth.identity.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WhoAmIResponse {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "id of the account that the credentials authenticate")
    private long accountId;
}
