// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

/**
 * A newly created observable together with its publisher.
 *
 * @param observable the read side, safe to hand out
 * @param publisher  the write side, kept by the creator
 * @param <T>        the value type
 */
public record ObservableSource<T>(Observable<T> observable, Publisher<T> publisher) {
}
