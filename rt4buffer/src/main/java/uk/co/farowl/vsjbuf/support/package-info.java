// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Classes used throughout the buffer runtime that are not themselves
 * Python objects.
 */
package uk.co.farowl.vsjbuf.support;
