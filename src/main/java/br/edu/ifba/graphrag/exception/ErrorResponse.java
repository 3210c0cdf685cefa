package br.edu.ifba.graphrag.exception;

/**
 * Problem details body (RFC 9457) returned by the exception mappers.
 */
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance
) {}
