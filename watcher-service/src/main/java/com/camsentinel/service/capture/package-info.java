/**
 * Recording collaborators: the {@code ffmpeg} stream-copy recorder and the
 * HTTP snapshot API.
 */
package com.camsentinel.service.capture;
