package com.tryonai.backend.listener;

import lombok.Value;

import java.util.UUID;

@Value
public class SessionCreatedEvent {
	UUID sessionId;
}
