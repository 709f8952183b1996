/**
 * Client side of the OMOTES job protocol: {@link com.omotes.sdk.OmotesInterface} submits, follows and
 * cancels jobs through a {@link com.omotes.protocol.bus.MessageBus}.
 */
package com.omotes.sdk;
