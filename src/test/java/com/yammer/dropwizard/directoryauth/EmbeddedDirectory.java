package com.yammer.dropwizard.directoryauth;

import java.io.File;
import java.net.InetAddress;

import javax.net.ssl.SSLSocketFactory;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.listener.InMemoryListenerConfig;
import com.unboundid.util.ObjectPair;
import com.unboundid.util.ssl.KeyStoreKeyManager;
import com.unboundid.util.ssl.SSLUtil;
import com.unboundid.ldap.listener.SelfSignedCertificateGenerator;

/**
 * In-memory directory for tests that need a real LDAP server on the other end of the socket. The listener accepts
 * StartTLS with a throwaway self-signed certificate.
 */
public class EmbeddedDirectory implements AutoCloseable {
    public static final String BASE_DN = "dc=example,dc=com";
    public static final String ADMIN_DN = "uid=admin," + BASE_DN;
    public static final String JDOE_DN = "uid=jdoe," + BASE_DN;
    public static final String STAFF_DN = "cn=staff,ou=groups," + BASE_DN;

    private final InMemoryDirectoryServer server;

    private EmbeddedDirectory(InMemoryDirectoryServer server) {
        this.server = server;
    }

    public static EmbeddedDirectory start() throws Exception {
        final ObjectPair<File, char[]> keyStore =
                SelfSignedCertificateGenerator.generateTemporarySelfSignedCertificate("directory-tests", "PKCS12");
        final SSLSocketFactory startTls = new SSLUtil(
                new KeyStoreKeyManager(keyStore.getFirst(), keyStore.getSecond(), "PKCS12", null), null)
                .createSSLSocketFactory();

        final InMemoryDirectoryServerConfig config = new InMemoryDirectoryServerConfig(BASE_DN);
        config.setSchema(null);
        config.setListenerConfigs(InMemoryListenerConfig.createLDAPConfig("ldap",
                InetAddress.getLoopbackAddress(), 0, startTls));

        final InMemoryDirectoryServer server = new InMemoryDirectoryServer(config);
        server.add("dn: " + BASE_DN, "objectClass: top", "objectClass: domain", "dc: example");
        server.add("dn: ou=people," + BASE_DN, "objectClass: organizationalUnit", "ou: people");
        server.add("dn: ou=contractors," + BASE_DN, "objectClass: organizationalUnit", "ou: contractors");
        server.add("dn: ou=groups," + BASE_DN, "objectClass: organizationalUnit", "ou: groups");
        server.add("dn: " + ADMIN_DN,
                "objectClass: person",
                "uid: admin",
                "cn: Directory Admin",
                "sn: Admin",
                "userPassword: secret");
        server.add("dn: " + JDOE_DN,
                "objectClass: person",
                "objectClass: inetOrgPerson",
                "uid: jdoe",
                "cn: John Doe",
                "sn: Doe",
                "displayName: John Doe",
                "memberOf: " + STAFF_DN,
                "userPassword: hunter2");
        for (String ou : new String[] {"people", "contractors"}) {
            server.add("dn: uid=pat,ou=" + ou + "," + BASE_DN,
                    "objectClass: person",
                    "uid: pat",
                    "cn: Pat",
                    "sn: Pat",
                    "userPassword: hunter2");
        }
        server.startListening();
        return new EmbeddedDirectory(server);
    }

    public int getPort() {
        return server.getListenPort();
    }

    /**
     * Plaintext configuration pointing at this server and binding as {@code uid=admin}.
     */
    public DirectoryConfiguration configuration() {
        return new DirectoryConfiguration()
                .setServer("127.0.0.1")
                .setPort(getPort())
                .setEncryption(EncryptionMode.NONE)
                .setBaseDn(BASE_DN)
                .setBindUsername("admin")
                .setBindPassword("secret");
    }

    @Override
    public void close() {
        server.shutDown(true);
    }
}
