package com.openforge.memkeep.agent;

public record ResetConfirmation(String status, String message) {}
