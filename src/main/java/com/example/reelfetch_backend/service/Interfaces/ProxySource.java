package com.example.reelfetch_backend.service.Interfaces;

import com.example.reelfetch_backend.model.Proxy;

import java.util.List;

public interface ProxySource {

    /** Loads the current proxy list; any failure surfaces as a runtime exception. */
    List<Proxy> fetchProxies();
}
