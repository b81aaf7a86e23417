package cafe.woden.ircengine.net;

import cafe.woden.ircengine.config.IrcEngineProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/** Initializes {@link NetTlsContext} from configuration properties. */
@Component
public class NetTlsBootstrap {

  private final IrcEngineProperties props;

  public NetTlsBootstrap(IrcEngineProperties props) {
    this.props = props;
  }

  @PostConstruct
  public void init() {
    NetTlsContext.configure(props == null ? null : props.client().tls());
  }
}
