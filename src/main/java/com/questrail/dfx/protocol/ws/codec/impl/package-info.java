/**
 * Default codec implementations and the framing constants shared by them.
 */
package com.questrail.dfx.protocol.ws.codec.impl;
