@NullMarked
package io.a2a.protocol.client.transport.spi;

import org.jspecify.annotations.NullMarked;
