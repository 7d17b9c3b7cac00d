/**
 * ONVIF PullPoint event subscription over SOAP 1.2, with WS-Addressing
 * headers and WS-Security UsernameToken digest authentication.
 */
package com.camsentinel.service.onvif;
