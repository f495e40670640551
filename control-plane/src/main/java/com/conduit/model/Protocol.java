package com.conduit.model;

public enum Protocol {
    HTTP,
    HTTPS,
    TCP,
    UDP
}
