package com.aiinpocket.gmtracker.model.dto;

public record AddressRequest(String address) {}
