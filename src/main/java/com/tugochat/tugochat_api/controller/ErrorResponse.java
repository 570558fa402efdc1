package com.tugochat.tugochat_api.controller;

public record ErrorResponse(String error) {}
