/**
 * Default Netty-buffer based implementations of the DataPoint codec
 * interfaces.
 */
package com.questrail.sensorlink.protocol.datapoint.codec.impl;
