// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Builders used to accumulate byte content, for example when a
 * non-contiguous buffer is collected into a fresh array.
 */
package uk.co.farowl.vsjbuf.stringlib;
