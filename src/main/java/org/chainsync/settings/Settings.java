package org.chainsync.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.persistence.exceptions.XMLMarshalException;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.UnmarshalException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.transform.stream.StreamSource;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class Settings {

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);
	private static final String SETTINGS_FILENAME = "settings.json";

	// Properties
	private static Settings instance;

	// Node request socket
	private String nodeHost = "127.0.0.1";
	private int nodePort = 18443;
	private String rpcUser = "user";
	private String rpcPassword = "password";
	/** Routes wallet RPCs to /wallet/{name} when set */
	private String walletName = null;

	/** Connect timeout for the request socket, ms */
	private int connectTimeout = 5000;
	/** Delay between reconnect attempts, ms */
	private long reconnectInterval = 2000L;
	private int maxReconnectAttempts = 10;

	// Node event socket (ZMQ)
	private int zmqPort = 28334;
	/** How long the event loop blocks waiting for a message before re-checking its subscriptions, ms */
	private int eventSocketPollInterval = 250;

	// Response cache
	private long cacheTimeout = 5 * 60 * 1000L;
	private int maxCacheSize = 10000;
	private long cacheSweepInterval = 60 * 1000L;

	// Wallet sync
	/** Consecutive empty addresses before an account role scan stops */
	private int gapLimit = 20;
	/** Confirmations before a transaction moves from pending to confirmed */
	private int minBlockConfirm = 1;
	/** Maximum watched addresses per account role */
	private int maxScriptWatch = 10;

	// Constructors

	private Settings() {
	}

	// Other methods

	public static synchronized Settings getInstance() {
		if (instance == null) {
			if (Files.exists(Paths.get(SETTINGS_FILENAME)))
				fileInstance(SETTINGS_FILENAME);
			else
				instance = new Settings();
		}

		return instance;
	}

	/**
	 * Parse settings from given file.
	 * Throws <tt>RuntimeException</tt> with <tt>UnmarshalException</tt> as cause if settings file could not be parsed.
	 * <p>
	 * We use this method for unit tests.
	 */
	public static synchronized Settings fileInstance(String filename) {
		Path path = Paths.get(filename);
		LOGGER.info("Using settings file: {}", path.toAbsolutePath());

		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			instance = unmarshall(reader);
		} catch (NoSuchFileException e) {
			String message = "Settings file not found: " + filename;
			LOGGER.error(message);
			throw new RuntimeException(message, e);
		} catch (IOException e) {
			String message = "Unable to read settings file: " + filename;
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}

		return instance;
	}

	/** Parse settings from JSON text, without touching the shared instance. */
	public static Settings fromJson(String json) {
		return unmarshall(new StringReader(json));
	}

	private static Settings unmarshall(Reader reader) {
		Settings settings;

		try {
			// Create JAXB context aware of Settings
			JAXBContext jc = JAXBContextFactory.createContext(new Class[] { Settings.class }, null);

			// Create unmarshaller
			Unmarshaller unmarshaller = jc.createUnmarshaller();

			// Set the unmarshaller media type to JSON
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");

			// Tell unmarshaller that there's no JSON root element in the JSON input
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);

			// Attempt to unmarshal JSON stream to Settings
			StreamSource json = new StreamSource(reader);
			settings = unmarshaller.unmarshal(json, Settings.class).getValue();
		} catch (UnmarshalException e) {
			Throwable linkedException = e.getLinkedException();
			if (linkedException instanceof XMLMarshalException) {
				String message = ((XMLMarshalException) linkedException).getInternalException().getLocalizedMessage();
				LOGGER.error(message);
				throw new RuntimeException(message, e);
			}

			String message = "Failed to parse settings";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		} catch (JAXBException e) {
			String message = "Failed to parse settings";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}

		settings.validate();

		return settings;
	}

	private void validate() {
		// Validation goes here
		if (this.nodePort <= 0 || this.nodePort > 65535)
			throwValidationError("nodePort must be a valid TCP port");

		if (this.zmqPort <= 0 || this.zmqPort > 65535)
			throwValidationError("zmqPort must be a valid TCP port");

		if (this.maxReconnectAttempts < 0)
			throwValidationError("maxReconnectAttempts must not be negative");

		if (this.maxCacheSize < 1)
			throwValidationError("maxCacheSize must be at least 1");

		if (this.cacheSweepInterval <= 0)
			throwValidationError("cacheSweepInterval must be positive");

		if (this.gapLimit < 1)
			throwValidationError("gapLimit must be at least 1");

		if (this.maxScriptWatch < 1)
			throwValidationError("maxScriptWatch must be at least 1");
	}

	private static void throwValidationError(String message) {
		throw new RuntimeException(message, new UnmarshalException(message));
	}

	// Getters / setters

	public String getNodeHost() {
		return this.nodeHost;
	}

	public int getNodePort() {
		return this.nodePort;
	}

	public String getRpcUser() {
		return this.rpcUser;
	}

	public String getRpcPassword() {
		return this.rpcPassword;
	}

	public String getWalletName() {
		return this.walletName;
	}

	public int getConnectTimeout() {
		return this.connectTimeout;
	}

	public long getReconnectInterval() {
		return this.reconnectInterval;
	}

	public int getMaxReconnectAttempts() {
		return this.maxReconnectAttempts;
	}

	public int getZmqPort() {
		return this.zmqPort;
	}

	public String getZmqEndpoint() {
		return String.format("tcp://%s:%d", this.nodeHost, this.zmqPort);
	}

	public int getEventSocketPollInterval() {
		return this.eventSocketPollInterval;
	}

	public long getCacheTimeout() {
		return this.cacheTimeout;
	}

	public int getMaxCacheSize() {
		return this.maxCacheSize;
	}

	public long getCacheSweepInterval() {
		return this.cacheSweepInterval;
	}

	public int getGapLimit() {
		return this.gapLimit;
	}

	public int getMinBlockConfirm() {
		return this.minBlockConfirm;
	}

	public int getMaxScriptWatch() {
		return this.maxScriptWatch;
	}

	@Override
	public String toString() {
		return String.format("node %s:%d, zmq %d, gapLimit %d, minBlockConfirm %d, maxScriptWatch %d",
				this.nodeHost, this.nodePort, this.zmqPort, this.gapLimit, this.minBlockConfirm, this.maxScriptWatch);
	}
}
