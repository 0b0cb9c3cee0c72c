package com.acme.rmq.cli.output;

public enum OutputFormat {
    PLAIN,
    JSON
}
