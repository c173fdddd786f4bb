package com.tenantgate.tenant;

/**
 * Raised by a controller instance that was evicted while a caller still held it;
 * the registry retries the call on the current instance.
 */
class ControllerRetiredException extends RuntimeException {

    ControllerRetiredException(String name) {
        super("Controller " + name + " was retired");
    }
}
