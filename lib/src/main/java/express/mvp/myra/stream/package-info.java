/**
 * Push-based, single-subscription event streams.
 *
 * <p>This package defines the stream contract used by the operators in this library, along with a
 * synchronous controller for publishing events and a few ready-made sources.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.stream.EventStream} - A listenable source of events
 *   <li>{@link express.mvp.myra.stream.StreamSubscription} - Pause, resume and cancel handle
 *   <li>{@link express.mvp.myra.stream.StreamController} - Publishes events to one listener
 *   <li>{@link express.mvp.myra.stream.EventStreams} - Factory methods for common sources
 * </ul>
 *
 * @see express.mvp.myra.stream.retry.RetryStream
 */
package express.mvp.myra.stream;
