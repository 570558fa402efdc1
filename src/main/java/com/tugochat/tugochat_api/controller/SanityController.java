package com.tugochat.tugochat_api.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class SanityController {

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Tug-o-Chat API is running!");
    }
}
