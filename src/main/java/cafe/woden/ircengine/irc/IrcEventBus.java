package cafe.woden.ircengine.irc;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;
import org.springframework.stereotype.Component;

/**
 * Default {@link IrcEventSink}: fans events out to RxJava subscribers.
 *
 * <p>The processor is serialized because several session threads emit concurrently.
 */
@Component
public class IrcEventBus implements IrcEventSink {

  private final FlowableProcessor<TopicEvent> bus =
      PublishProcessor.<TopicEvent>create().toSerialized();

  @Override
  public void emit(String topic, IrcEvent event) {
    if (event == null) return;
    bus.onNext(new TopicEvent(Objects.toString(topic, DEFAULT_TOPIC), event));
  }

  /** All events regardless of topic. */
  public Flowable<IrcEvent> events() {
    return bus.onBackpressureBuffer().map(TopicEvent::event);
  }

  public Flowable<IrcEvent> events(String topic) {
    return bus.onBackpressureBuffer().filter(e -> e.topic().equals(topic)).map(TopicEvent::event);
  }

  public Flowable<IrcEvent> eventsFor(String connectionId) {
    return events().filter(e -> Objects.equals(e.connectionId(), connectionId));
  }

  @ValueObject
  record TopicEvent(String topic, IrcEvent event) {}
}
