package com.scholary.followalong.api;

/** Plain acknowledgement body. */
public record MessageResponse(String message) {}
