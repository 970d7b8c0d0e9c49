package com.phillippitts.trackembed.service.index;

/**
 * Creates fresh transport handles; called once at connect and again after every
 * connection-class failure.
 */
@FunctionalInterface
public interface VectorIndexTransportFactory {

    VectorIndexTransport create();
}
