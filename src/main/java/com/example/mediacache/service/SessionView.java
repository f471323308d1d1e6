package com.example.mediacache.service;

import com.example.mediacache.session.RateLimitStatus;
import com.example.mediacache.session.Session;

public record SessionView(Session session, RateLimitStatus rateLimit, boolean showDelay) {
}
