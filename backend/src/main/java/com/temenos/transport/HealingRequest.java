package com.temenos.transport;

import java.util.List;

public record HealingRequest(String prompt, String systemPrompt, List<ChatTurn> messages, String model) {}
