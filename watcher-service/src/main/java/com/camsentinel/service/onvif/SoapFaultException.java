package com.camsentinel.service.onvif;

import java.io.IOException;

/**
 * The device answered with a SOAP fault.
 */
public class SoapFaultException extends IOException {

    private static final long serialVersionUID = 1L;

    public SoapFaultException(String reason) {
        super("SOAP fault: " + reason);
    }
}
