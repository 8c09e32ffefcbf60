package com.aiinpocket.gmtracker.model.dto;

import com.aiinpocket.gmtracker.model.enums.ResetScope;

public record ResetResult(ResetScope scope, long deleted) {}
