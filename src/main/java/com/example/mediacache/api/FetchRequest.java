package com.example.mediacache.api;

public record FetchRequest(String url) {
}
