package com.polyglot.application.user;

import com.polyglot.domain.user.UserId;

import java.time.Instant;

/** @param asOf instant used to count due vocabulary */
public record GetUserSummaryQuery(UserId userId, Instant asOf) {
}
