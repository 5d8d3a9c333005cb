/**
 * Secondary retry windows: {@link com.sailfish.retry.factory.RetryWindow} and the
 * class-keyed {@link com.sailfish.retry.factory.ExceptionClassWindows} registry.
 */
package com.sailfish.retry.factory;
