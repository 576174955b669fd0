package io.clusterprobe.certs;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import io.clusterprobe.enums.CertificateRole;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.IOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

import static io.clusterprobe.config.Constants.*;

/**
 * Ephemeral certificate authority scoped to a single run.
 *
 * <p>The authority lives in memory only. It signs one server certificate bound to the
 * advertise address and one client certificate per workload, so the transport can attribute
 * every submission to a dispatched workload and reject anything issued elsewhere.
 */
@Slf4j
public class CertificateAuthority {

    private static final Duration VALIDITY = Duration.ofHours(CERTIFICATE_VALIDITY_HOURS);
    private static final Duration BACKDATE = Duration.ofMinutes(CERTIFICATE_BACKDATE_MINUTES);

    private final KeyPair keyPair;
    private final X500Name name;
    private final X509Certificate certificate;
    private final Clock clock;
    private final SecureRandom random;

    private CertificateAuthority(KeyPair keyPair, X500Name name, X509Certificate certificate,
                                 Clock clock, SecureRandom random) {
        this.keyPair = keyPair;
        this.name = name;
        this.certificate = certificate;
        this.clock = clock;
        this.random = random;
    }

    public static CertificateAuthority create() throws CertificateAuthorityException {
        return create(Clock.systemUTC());
    }

    static CertificateAuthority create(Clock clock) throws CertificateAuthorityException {
        SecureRandom random = new SecureRandom();
        KeyPair keyPair = generateKeyPair(random);
        X500Name name = commonName(CA_SUBJECT);
        Instant now = clock.instant();
        try {
            JcaX509ExtensionUtils extensions = new JcaX509ExtensionUtils();
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                name,
                serial(random),
                Date.from(now.minus(BACKDATE)),
                Date.from(now.plus(VALIDITY)),
                name,
                keyPair.getPublic());
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(0));
            builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign | KeyUsage.digitalSignature));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                extensions.createSubjectKeyIdentifier(keyPair.getPublic()));
            X509Certificate certificate = sign(builder, keyPair);
            log.info("Created certificate authority {} valid until {}", CA_SUBJECT, certificate.getNotAfter());
            return new CertificateAuthority(keyPair, name, certificate, clock, random);
        } catch (NoSuchAlgorithmException | CertIOException | OperatorCreationException | CertificateException e) {
            throw new CertificateAuthorityException("couldn't create certificate authority", e);
        }
    }

    /**
     * Issue the server certificate for the given advertise address and wrap it, together with a
     * trust store holding only this authority, into a TLS context that demands client certificates.
     *
     * @param advertiseAddress host, IP literal or {@code host:port} workloads will connect to
     * @throws CertificateAuthorityException if the address cannot be parsed or signing fails
     */
    public ServerTlsConfig serverConfig(String advertiseAddress) throws CertificateAuthorityException {
        String host = advertiseHost(advertiseAddress);
        GeneralName san = InetAddresses.isInetAddress(host)
            ? new GeneralName(GeneralName.iPAddress, host)
            : new GeneralName(GeneralName.dNSName, host);

        KeyPair serverKeys = generateKeyPair(random);
        X509Certificate serverCertificate = issue(
            commonName(host),
            serverKeys.getPublic(),
            KeyPurposeId.id_kp_serverAuth,
            new GeneralNames(san));
        try {
            return new ServerTlsConfig(
                TlsContexts.create(
                    serverKeys.getPrivate(),
                    new X509Certificate[]{serverCertificate, certificate},
                    certificate),
                CertificateIdentity.of(host, CertificateRole.SERVER, serverCertificate),
                serverCertificate,
                certificate);
        } catch (GeneralSecurityException | IOException e) {
            throw new CertificateAuthorityException("couldn't build server TLS context for " + host, e);
        }
    }

    /**
     * Issue a client certificate whose subject names the workload.
     */
    public ClientIdentity clientIdentity(String workloadName) throws CertificateAuthorityException {
        if (workloadName == null || workloadName.isBlank()) {
            throw new CertificateAuthorityException("workload name is required for a client certificate");
        }
        KeyPair clientKeys = generateKeyPair(random);
        X509Certificate clientCertificate = issue(
            commonName(workloadName),
            clientKeys.getPublic(),
            KeyPurposeId.id_kp_clientAuth,
            null);
        log.debug("Issued client certificate for workload {}", workloadName);
        return new ClientIdentity(
            CertificateIdentity.of(workloadName, CertificateRole.CLIENT, clientCertificate),
            clientCertificate,
            clientKeys.getPrivate(),
            certificate);
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public CertificateIdentity getIdentity() {
        return CertificateIdentity.of(CA_SUBJECT, CertificateRole.AUTHORITY, certificate);
    }

    /**
     * Common name of a certificate's subject, the identity a workload submits under.
     */
    public static Optional<String> subjectName(X509Certificate certificate) {
        X500Name subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        RDN[] rdns = subject.getRDNs(BCStyle.CN);
        if (rdns.length == 0 || rdns[0].getFirst() == null) {
            return Optional.empty();
        }
        ASN1Encodable value = rdns[0].getFirst().getValue();
        if (value instanceof ASN1String) {
            return Optional.of(((ASN1String) value).getString());
        }
        return Optional.of(value.toString());
    }

    /**
     * Strip an optional port from the advertise address and validate what remains.
     */
    static String advertiseHost(String advertiseAddress) throws CertificateAuthorityException {
        if (advertiseAddress == null || advertiseAddress.isBlank()) {
            throw new CertificateAuthorityException("advertise address is required");
        }
        String host;
        try {
            host = HostAndPort.fromString(advertiseAddress.trim()).getHost();
        } catch (IllegalArgumentException e) {
            throw new CertificateAuthorityException("couldn't parse advertise address " + advertiseAddress, e);
        }
        if (!InetAddresses.isInetAddress(host) && !InternetDomainName.isValid(host)) {
            throw new CertificateAuthorityException("advertise address " + advertiseAddress + " is not a valid host");
        }
        if (InetAddresses.isInetAddress(host) && InetAddresses.forString(host).isAnyLocalAddress()) {
            throw new CertificateAuthorityException("advertise address " + advertiseAddress
                + " is a wildcard address; set aggregation.advertise_address or " + ENV_POD_IP);
        }
        return host;
    }

    private X509Certificate issue(X500Name subject, PublicKey publicKey, KeyPurposeId purpose, GeneralNames sans)
            throws CertificateAuthorityException {
        Instant now = clock.instant();
        try {
            JcaX509ExtensionUtils extensions = new JcaX509ExtensionUtils();
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                name,
                serial(random),
                Date.from(now.minus(BACKDATE)),
                Date.from(now.plus(VALIDITY)),
                subject,
                publicKey);
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
            builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature));
            builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(purpose));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                extensions.createSubjectKeyIdentifier(publicKey));
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                extensions.createAuthorityKeyIdentifier(certificate));
            if (sans != null) {
                builder.addExtension(Extension.subjectAlternativeName, false, sans);
            }
            return sign(builder, keyPair);
        } catch (NoSuchAlgorithmException | CertIOException | OperatorCreationException | CertificateException e) {
            throw new CertificateAuthorityException("couldn't sign certificate for " + subject, e);
        }
    }

    private static X509Certificate sign(X509v3CertificateBuilder builder, KeyPair signer)
            throws OperatorCreationException, CertificateException {
        ContentSigner contentSigner = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(signer.getPrivate());
        return new JcaX509CertificateConverter().getCertificate(builder.build(contentSigner));
    }

    private static KeyPair generateKeyPair(SecureRandom random) throws CertificateAuthorityException {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
            generator.initialize(new ECGenParameterSpec(KEY_CURVE), random);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new CertificateAuthorityException("couldn't generate " + KEY_CURVE + " key pair", e);
        }
    }

    private static X500Name commonName(String value) {
        return new X500NameBuilder(BCStyle.INSTANCE).addRDN(BCStyle.CN, value).build();
    }

    private static BigInteger serial(SecureRandom random) {
        return new BigInteger(63, random).add(BigInteger.ONE);
    }
}
