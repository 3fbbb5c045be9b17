package com.portfolio.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Body of a successful login or registration. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(UserView user, String token, Boolean requireTwoFactor) {
}
