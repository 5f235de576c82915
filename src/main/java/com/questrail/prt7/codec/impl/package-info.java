/**
 * Default PRT-7 codec implementation.
 *
 * <p>Only {@link com.questrail.prt7.codec.impl.DefaultPrt7FrameDecoder} is public;
 * helpers are package-private.</p>
 */
package com.questrail.prt7.codec.impl;
